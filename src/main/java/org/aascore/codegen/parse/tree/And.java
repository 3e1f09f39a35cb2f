package org.aascore.codegen.parse.tree;

import java.util.List;

public record And(List<Expression> values) implements Expression {

    public And {
        values = List.copyOf(values);
        if (values.size() < 2) {
            throw new IllegalArgumentException("Expected at least two operands, got " + values.size());
        }
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitAnd(this);
    }
}
