package org.aascore.codegen.common;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A validated name of a symbol, property, method, argument or literal.
 *
 * @param value The name; non-empty, letters, digits and underscores, not starting with a digit
 */
public record Identifier(String value) implements Comparable<Identifier> {

    public static final Pattern PATTERN = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9]*");

    public Identifier {
        Objects.requireNonNull(value, "Identifier value cannot be null");
        if (!isValid(value)) {
            throw new IllegalArgumentException("Invalid identifier: " + value);
        }
    }

    public static Identifier of(String value) {
        return new Identifier(value);
    }

    public static boolean isValid(String value) {
        return value != null && PATTERN.matcher(value).matches();
    }

    @Override
    public int compareTo(Identifier other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
