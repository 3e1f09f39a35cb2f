package org.aascore.codegen.parse.tree;

import java.util.Objects;

public record IsNone(Expression value) implements Expression {

    public IsNone {
        Objects.requireNonNull(value, "Checked value cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitIsNone(this);
    }
}
