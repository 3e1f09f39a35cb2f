package org.aascore.codegen.parse.tree;

import java.util.List;
import java.util.Objects;

/**
 * Declarations evaluated in order and then an expression that may use them,
 * written as {@code (x := value, expression)[1]}.
 */
public record ExpressionWithDeclarations(List<Declaration> declarations, Expression expression)
        implements Expression {

    public ExpressionWithDeclarations {
        declarations = List.copyOf(declarations);
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    @Override
    public <T> T accept(TreeVisitor<T> visitor) {
        return visitor.visitExpressionWithDeclarations(this);
    }
}
