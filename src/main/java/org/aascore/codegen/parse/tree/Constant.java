package org.aascore.codegen.parse.tree;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A literal value: Boolean, BigInteger, Double or String.
 */
public record Constant(Object value) implements Expression {

    public Constant {
        Objects.requireNonNull(value, "Constant value cannot be null");
        if (!(value instanceof Boolean || value instanceof BigInteger
                || value instanceof Double || value instanceof String)) {
            throw new IllegalArgumentException("Unsupported constant: " + value.getClass().getSimpleName());
        }
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }
}
