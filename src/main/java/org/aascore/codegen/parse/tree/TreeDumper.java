package org.aascore.codegen.parse.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree node as a single-line, deterministic string, e.g.
 * {@code Comparison(left=Name(self), op=GT, right=Constant(0))}.
 */
public final class TreeDumper implements TreeVisitor<String> {

    private static final TreeDumper INSTANCE = new TreeDumper();

    private TreeDumper() {
    }

    public static String dump(TreeNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitMember(Member node) {
        return "Member(instance=" + node.instance().accept(this) + ", name=" + node.name() + ")";
    }

    @Override
    public String visitComparison(Comparison node) {
        return "Comparison(left=" + node.left().accept(this)
                + ", op=" + node.op()
                + ", right=" + node.right().accept(this) + ")";
    }

    @Override
    public String visitImplication(Implication node) {
        return "Implication(antecedent=" + node.antecedent().accept(this)
                + ", consequent=" + node.consequent().accept(this) + ")";
    }

    @Override
    public String visitMethodCall(MethodCall node) {
        return "MethodCall(member=" + node.member().accept(this)
                + ", args=" + list(node.args())
                + ", kwargs=" + keywords(node.kwargs()) + ")";
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        return "FunctionCall(name=" + node.name()
                + ", args=" + list(node.args())
                + ", kwargs=" + keywords(node.kwargs()) + ")";
    }

    @Override
    public String visitConstant(Constant node) {
        return "Constant(" + literal(node.value()) + ")";
    }

    @Override
    public String visitIsNone(IsNone node) {
        return "IsNone(" + node.value().accept(this) + ")";
    }

    @Override
    public String visitIsNotNone(IsNotNone node) {
        return "IsNotNone(" + node.value().accept(this) + ")";
    }

    @Override
    public String visitName(Name node) {
        return "Name(" + node.identifier() + ")";
    }

    @Override
    public String visitAnd(And node) {
        return "And(" + list(node.values()) + ")";
    }

    @Override
    public String visitOr(Or node) {
        return "Or(" + list(node.values()) + ")";
    }

    @Override
    public String visitDeclaration(Declaration node) {
        return "Declaration(identifier=" + node.identifier() + ", value=" + node.value().accept(this) + ")";
    }

    @Override
    public String visitExpressionWithDeclarations(ExpressionWithDeclarations node) {
        return "ExpressionWithDeclarations(declarations=" + list(node.declarations())
                + ", expression=" + node.expression().accept(this) + ")";
    }

    private String list(List<? extends TreeNode> nodes) {
        return nodes.stream().map(n -> n.accept(this)).collect(Collectors.joining(", ", "[", "]"));
    }

    private String keywords(List<KeywordArgument> kwargs) {
        return kwargs.stream()
                .map(kw -> kw.arg() + "=" + kw.value().accept(this))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    static String literal(Object value) {
        if (value instanceof String text) {
            return "'" + text.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + "'";
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        return String.valueOf(value);
    }
}
