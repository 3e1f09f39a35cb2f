package org.aascore.codegen.parse.tree;

import org.aascore.codegen.common.Identifier;

import java.util.List;
import java.util.Objects;

/**
 * A call of a free function by name, e.g. {@code len(self.items)}.
 */
public record FunctionCall(Identifier name, List<Expression> args, List<KeywordArgument> kwargs)
        implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        args = List.copyOf(args);
        kwargs = List.copyOf(kwargs);
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
