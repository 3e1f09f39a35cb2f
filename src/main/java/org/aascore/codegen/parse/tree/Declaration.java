package org.aascore.codegen.parse.tree;

import org.aascore.codegen.common.Identifier;

import java.util.Objects;

/**
 * Binding of a local name, e.g. {@code (x := self.value)}.
 */
public record Declaration(Identifier identifier, Expression value) implements TreeNode {

    public Declaration {
        Objects.requireNonNull(identifier, "Declared identifier cannot be null");
        Objects.requireNonNull(value, "Declared value cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitDeclaration(this);
    }
}
