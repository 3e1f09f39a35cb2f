package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.syntax.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads type annotations of properties, arguments and results.
 */
public final class TypeExpressionParser {

    private final LineIndex source;

    public TypeExpressionParser(LineIndex source) {
        this.source = source;
    }

    /**
     * @throws MetaModelCompileException on a bare {@code Final} or an unsupported shape
     */
    public TypeExpression parse(Expr node) {
        if (node instanceof Expr.Name name && name.id().equals("Final")) {
            throw new MetaModelCompileException(node.span(),
                    "The type annotation ``Final`` needs to be subscripted with exactly one type");
        }

        if (node instanceof Expr.Name name) {
            return new TypeExpression.Atomic(Identifier.of(name.id()));
        }

        if (node instanceof Expr.Constant constant && constant.isString()) {
            String text = (String) constant.value();
            if (!Identifier.isValid(text)) {
                throw new MetaModelCompileException(node.span(),
                        "Expected the string type annotation to name a type, but got: " + source.text(node.span()));
            }
            return new TypeExpression.Atomic(Identifier.of(text));
        }

        if (node instanceof Expr.Subscript subscript) {
            if (!(subscript.value() instanceof Expr.Name name)) {
                throw new MetaModelCompileException(subscript.value().span(),
                        "Expected a name as the subscripted type, but got: " + source.text(subscript.value().span()));
            }

            List<Expr> elements = subscript.slice() instanceof Expr.Tuple tuple
                    ? tuple.elements()
                    : List.of(subscript.slice());
            if (elements.isEmpty()) {
                throw new MetaModelCompileException(subscript.span(),
                        "Unexpected subscripted type without subscripts: " + source.text(subscript.span()));
            }

            List<TypeExpression> subscripts = new ArrayList<>();
            for (Expr element : elements) {
                subscripts.add(parse(element));
            }
            return new TypeExpression.Subscripted(Identifier.of(name.id()), subscripts);
        }

        throw new MetaModelCompileException(node.span(),
                "Unexpected type annotation: " + source.text(node.span()));
    }
}
