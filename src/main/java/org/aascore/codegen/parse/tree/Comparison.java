package org.aascore.codegen.parse.tree;

import java.util.Objects;

public record Comparison(Expression left, Comparator op, Expression right) implements Expression {

    public Comparison {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(op, "Comparator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }
}
