package org.aascore.codegen.parse.tree;

import org.aascore.codegen.common.Identifier;

import java.util.Objects;

/**
 * Access of a member, e.g. {@code self.some_property}.
 */
public record Member(Expression instance, Identifier name) implements Expression {

    public Member {
        Objects.requireNonNull(instance, "Member instance cannot be null");
        Objects.requireNonNull(name, "Member name cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitMember(this);
    }
}
