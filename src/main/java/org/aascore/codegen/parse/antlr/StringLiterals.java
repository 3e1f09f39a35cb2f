package org.aascore.codegen.parse.antlr;

/**
 * Decodes the text of a STRING token into its value.
 */
final class StringLiterals {

    private StringLiterals() {
        // Static utility class
    }

    static String decode(String token) {
        int prefixLength = 0;
        while (prefixLength < token.length()
                && token.charAt(prefixLength) != '\''
                && token.charAt(prefixLength) != '"') {
            prefixLength++;
        }
        String prefix = token.substring(0, prefixLength).toLowerCase();
        String quoted = token.substring(prefixLength);

        int quoteLength = quoted.startsWith("\"\"\"") || quoted.startsWith("'''") ? 3 : 1;
        String body = quoted.substring(quoteLength, quoted.length() - quoteLength);

        return prefix.contains("r") ? body : unescape(body);
    }

    private static String unescape(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }

            char next = body.charAt(i + 1);
            switch (next) {
                case '\n' -> i += 2;
                case '\r' -> i += (i + 2 < body.length() && body.charAt(i + 2) == '\n') ? 3 : 2;
                case '\\', '\'', '"' -> {
                    sb.append(next);
                    i += 2;
                }
                case 'n' -> {
                    sb.append('\n');
                    i += 2;
                }
                case 't' -> {
                    sb.append('\t');
                    i += 2;
                }
                case 'r' -> {
                    sb.append('\r');
                    i += 2;
                }
                case 'a' -> {
                    sb.append('\u0007');
                    i += 2;
                }
                case 'b' -> {
                    sb.append('\b');
                    i += 2;
                }
                case 'f' -> {
                    sb.append('\f');
                    i += 2;
                }
                case 'v' -> {
                    sb.append('\u000B');
                    i += 2;
                }
                case 'x' -> i = appendCodePoint(body, i, 2, sb);
                case 'u' -> i = appendCodePoint(body, i, 4, sb);
                case 'U' -> i = appendCodePoint(body, i, 8, sb);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i + 1;
                        while (end < body.length() && end < i + 4
                                && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        sb.append((char) Integer.parseInt(body.substring(i + 1, end), 8));
                        i = end;
                    } else {
                        // Unknown escapes are kept verbatim.
                        sb.append(c).append(next);
                        i += 2;
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int appendCodePoint(String body, int backslash, int digits, StringBuilder sb) {
        int start = backslash + 2;
        int end = start + digits;
        if (end > body.length() || !isHex(body.substring(start, end))) {
            sb.append(body, backslash, Math.min(start, body.length()));
            return start;
        }
        long codePoint = Long.parseLong(body.substring(start, end), 16);
        if (codePoint > Character.MAX_CODE_POINT) {
            sb.append(body, backslash, end);
        } else {
            sb.appendCodePoint((int) codePoint);
        }
        return end;
    }

    private static boolean isHex(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
