package org.aascore.codegen.parse.tree;

/**
 * A tree node that evaluates to a value.
 */
public sealed interface Expression extends TreeNode
        permits Member, Comparison, Implication, MethodCall, FunctionCall, Constant,
        IsNone, IsNotNone, Name, And, Or, ExpressionWithDeclarations {
}
