package org.aascore.codegen.parse.tree;

import java.util.List;

public record Or(List<Expression> values) implements Expression {

    public Or {
        values = List.copyOf(values);
        if (values.size() < 2) {
            throw new IllegalArgumentException("Expected at least two operands, got " + values.size());
        }
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitOr(this);
    }
}
