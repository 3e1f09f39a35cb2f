package org.aascore.codegen.parse.tree;

import java.util.Objects;

public record IsNotNone(Expression value) implements Expression {

    public IsNotNone {
        Objects.requireNonNull(value, "Checked value cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitIsNotNone(this);
    }
}
