package org.aascore.codegen.parse.rules;

import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.syntax.Expr;
import org.aascore.codegen.parse.tree.TreeNode;

/**
 * One shape of host expression that can be turned into a tree node.
 */
public interface ParseRule {

    /**
     * @return True if this rule is responsible for the node
     */
    boolean matches(Expr node);

    /**
     * Transforms a node this rule matches, parsing sub-expressions through the parser.
     *
     * @throws MetaModelCompileException if a sub-expression can not be parsed
     */
    TreeNode transform(Expr node, ExpressionParser parser);

    default String name() {
        return getClass().getSimpleName();
    }
}
