package org.aascore.codegen.parse.tree;

import java.util.List;
import java.util.Objects;

/**
 * A call whose target is a member, e.g. {@code self.something.is_valid()}.
 */
public record MethodCall(Member member, List<Expression> args, List<KeywordArgument> kwargs)
        implements Expression {

    public MethodCall {
        Objects.requireNonNull(member, "Member cannot be null");
        args = List.copyOf(args);
        kwargs = List.copyOf(kwargs);
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitMethodCall(this);
    }
}
