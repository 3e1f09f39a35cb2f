package org.aascore.codegen.parse;

import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.syntax.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits docstrings into summary, remarks and field list, and collects the
 * cross references they contain.
 */
public final class DescriptionParser {

    private static final Pattern FIELD = Pattern.compile("^:([^:`\\s][^:`]*):(?:\\s+(.*))?$");
    private static final Pattern CLASS_REFERENCE = Pattern.compile(":class:`([^`]*)`");
    private static final Pattern ATTRIBUTE_REFERENCE = Pattern.compile(":py:attr:`([^`]*)`");

    private DescriptionParser() {
        // Static utility class
    }

    /**
     * @param docstring A string constant
     * @throws MetaModelCompileException if the docstring is empty or lacks a summary
     */
    public static Description parse(Expr.Constant docstring) {
        if (!docstring.isString()) {
            throw new MetaModelCompileException(docstring.span(),
                    "Expected a string literal as a description, but got: " + docstring.value());
        }

        List<String> lines = clean((String) docstring.value());
        if (lines.isEmpty()) {
            throw new MetaModelCompileException(docstring.span(), "Unexpected empty description");
        }

        String summary = null;
        List<String> remarks = new ArrayList<>();
        List<Description.Field> fields = new ArrayList<>();

        for (List<String> block : blocks(lines)) {
            if (FIELD.matcher(block.get(0)).matches()) {
                if (summary == null) {
                    throw new MetaModelCompileException(docstring.span(),
                            "Expected a summary paragraph before the field list in the description");
                }
                fields.addAll(fields(block));
            } else if (summary == null) {
                summary = String.join("\n", block);
            } else {
                remarks.add(String.join("\n", block));
            }
        }

        String text = String.join("\n", lines);
        return new Description(
                summary,
                remarks,
                fields,
                matches(CLASS_REFERENCE, text),
                matches(ATTRIBUTE_REFERENCE, text),
                docstring.span());
    }

    /**
     * Strips the first line, removes the indentation common to the remaining
     * lines and drops leading and trailing blank lines.
     */
    static List<String> clean(String text) {
        String[] raw = text.replace("\r\n", "\n").replace('\r', '\n').split("\n", -1);

        int indent = Integer.MAX_VALUE;
        for (int i = 1; i < raw.length; i++) {
            String line = raw[i];
            if (!line.isBlank()) {
                indent = Math.min(indent, line.length() - line.stripLeading().length());
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add(raw[0].strip());
        for (int i = 1; i < raw.length; i++) {
            String line = raw[i];
            lines.add(line.isBlank() ? "" : line.substring(indent).stripTrailing());
        }

        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    private static List<List<String>> blocks(List<String> lines) {
        List<List<String>> blocks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String line : lines) {
            if (line.isEmpty()) {
                if (!current.isEmpty()) {
                    blocks.add(current);
                    current = new ArrayList<>();
                }
            } else {
                current.add(line);
            }
        }
        if (!current.isEmpty()) {
            blocks.add(current);
        }
        return blocks;
    }

    private static List<Description.Field> fields(List<String> block) {
        List<Description.Field> fields = new ArrayList<>();
        String name = null;
        StringBuilder body = new StringBuilder();
        for (String line : block) {
            Matcher matcher = FIELD.matcher(line);
            if (matcher.matches()) {
                if (name != null) {
                    fields.add(new Description.Field(name, body.toString()));
                }
                name = matcher.group(1).strip();
                body = new StringBuilder(matcher.group(2) == null ? "" : matcher.group(2).strip());
            } else {
                // Continuation of the previous field
                if (body.length() > 0) {
                    body.append('\n');
                }
                body.append(line.strip());
            }
        }
        if (name != null) {
            fields.add(new Description.Field(name, body.toString()));
        }
        return fields;
    }

    private static List<String> matches(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        return found;
    }
}
