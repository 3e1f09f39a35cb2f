package org.aascore.codegen.parse.tree;

/**
 * Visitor over the closed set of tree nodes; adding a node kind breaks every
 * implementation until it handles the new kind.
 */
public interface TreeVisitor<T> {

    T visitMember(Member node);

    T visitComparison(Comparison node);

    T visitImplication(Implication node);

    T visitMethodCall(MethodCall node);

    T visitFunctionCall(FunctionCall node);

    T visitConstant(Constant node);

    T visitIsNone(IsNone node);

    T visitIsNotNone(IsNotNone node);

    T visitName(Name node);

    T visitAnd(And node);

    T visitOr(Or node);

    T visitDeclaration(Declaration node);

    T visitExpressionWithDeclarations(ExpressionWithDeclarations node);
}
