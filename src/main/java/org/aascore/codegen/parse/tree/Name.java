package org.aascore.codegen.parse.tree;

import org.aascore.codegen.common.Identifier;

import java.util.Objects;

public record Name(Identifier identifier) implements Expression {

    public Name {
        Objects.requireNonNull(identifier, "Name identifier cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitName(this);
    }
}
