package org.aascore.codegen.parse.rules;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.syntax.Expr;
import org.aascore.codegen.parse.tree.And;
import org.aascore.codegen.parse.tree.Comparator;
import org.aascore.codegen.parse.tree.Comparison;
import org.aascore.codegen.parse.tree.Constant;
import org.aascore.codegen.parse.tree.Declaration;
import org.aascore.codegen.parse.tree.Expression;
import org.aascore.codegen.parse.tree.ExpressionWithDeclarations;
import org.aascore.codegen.parse.tree.FunctionCall;
import org.aascore.codegen.parse.tree.Implication;
import org.aascore.codegen.parse.tree.IsNone;
import org.aascore.codegen.parse.tree.IsNotNone;
import org.aascore.codegen.parse.tree.KeywordArgument;
import org.aascore.codegen.parse.tree.Member;
import org.aascore.codegen.parse.tree.MethodCall;
import org.aascore.codegen.parse.tree.Name;
import org.aascore.codegen.parse.tree.Or;
import org.aascore.codegen.parse.tree.TreeDumper;
import org.aascore.codegen.parse.tree.TreeNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns host expressions of invariants and contracts into tree nodes.
 *
 * The rules are tried in the order of {@link #chain()}, which is the order in
 * which they are declared below; the first rule that matches commits, and a
 * failure in a sub-expression aborts the whole transformation.
 */
public final class ExpressionParser {

    private static final Map<Expr.CompareOperator, Comparator> COMPARATORS = Map.of(
            Expr.CompareOperator.LT, Comparator.LT,
            Expr.CompareOperator.LE, Comparator.LE,
            Expr.CompareOperator.GT, Comparator.GT,
            Expr.CompareOperator.GE, Comparator.GE,
            Expr.CompareOperator.EQ, Comparator.EQ,
            Expr.CompareOperator.NE, Comparator.NE);

    private static final List<ParseRule> CHAIN = List.of(
            new ParseComparison(),
            new ParseCall(),
            new ParseConstant(),
            new ParseImplication(),
            new ParseMember(),
            new ParseName(),
            new ParseIsNoneOrIsNotNone(),
            new ParseAndOrOr(),
            new ParseExpressionWithDeclaration(),
            new ParseDeclaration());

    private final LineIndex source;

    /**
     * @param source Index of the text the expressions were parsed from, used in error messages
     */
    public ExpressionParser(LineIndex source) {
        this.source = source;
    }

    public static List<ParseRule> chain() {
        return CHAIN;
    }

    /**
     * @throws MetaModelCompileException if no rule matches the node or one of its sub-expressions
     */
    public TreeNode parse(Expr node) {
        for (ParseRule rule : CHAIN) {
            if (rule.matches(node)) {
                return rule.transform(node, this);
            }
        }
        throw new MetaModelCompileException(node.span(),
                "The code matched no pattern for transpilation at the parse stage: " + text(node));
    }

    /**
     * Like {@link #parse(Expr)}, but the result must be an expression rather than a declaration.
     */
    public Expression parseExpression(Expr node) {
        TreeNode result = parse(node);
        if (result instanceof Expression expression) {
            return expression;
        }
        throw new MetaModelCompileException(node.span(),
                "Expected an expression, but got: " + TreeDumper.dump(result));
    }

    String text(Expr node) {
        return source.text(node.span());
    }

    // ------------------------------------------------------------------ Rules

    static final class ParseComparison implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.Compare compare
                    && compare.operators().size() == 1
                    && COMPARATORS.containsKey(compare.operators().get(0));
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.Compare compare = (Expr.Compare) node;
            Expression left = parser.parseExpression(compare.left());
            Comparator op = COMPARATORS.get(compare.operators().get(0));
            Expression right = parser.parseExpression(compare.comparators().get(0));
            return new Comparison(left, op, right);
        }
    }

    static final class ParseCall implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.Call;
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.Call call = (Expr.Call) node;

            List<Expression> args = new ArrayList<>();
            for (Expr argNode : call.args()) {
                args.add(parser.parseExpression(argNode));
            }

            List<KeywordArgument> kwargs = new ArrayList<>();
            for (Expr.Keyword keyword : call.keywords()) {
                if (keyword.arg() == null) {
                    throw new MetaModelCompileException(keyword.span(),
                            "Unexpected double-star keyword argument in a call: " + parser.text(call));
                }
                kwargs.add(new KeywordArgument(Identifier.of(keyword.arg()), parser.parseExpression(keyword.value())));
            }

            if (call.func() instanceof Expr.Name name) {
                return new FunctionCall(Identifier.of(name.id()), args, kwargs);
            }

            TreeNode target = parser.parse(call.func());
            if (!(target instanceof Member member)) {
                throw new MetaModelCompileException(call.func().span(),
                        "Expected a member as the target of a method call, but got: " + parser.text(call.func()));
            }
            return new MethodCall(member, args, kwargs);
        }
    }

    static final class ParseConstant implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.Constant constant && !constant.isNone();
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            return new Constant(((Expr.Constant) node).value());
        }
    }

    static final class ParseImplication implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.BoolOp boolOp
                    && boolOp.operator() == Expr.BoolOperator.OR
                    && boolOp.values().size() == 2
                    && boolOp.values().get(0) instanceof Expr.UnaryOp unary
                    && unary.operator() == Expr.UnaryOperator.NOT;
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.BoolOp boolOp = (Expr.BoolOp) node;
            Expr.UnaryOp negation = (Expr.UnaryOp) boolOp.values().get(0);
            Expression antecedent = parser.parseExpression(negation.operand());
            Expression consequent = parser.parseExpression(boolOp.values().get(1));
            return new Implication(antecedent, consequent);
        }
    }

    static final class ParseMember implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.Attribute;
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.Attribute attribute = (Expr.Attribute) node;
            Expression instance = parser.parseExpression(attribute.value());
            return new Member(instance, Identifier.of(attribute.attr()));
        }
    }

    static final class ParseName implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.Name;
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            return new Name(Identifier.of(((Expr.Name) node).id()));
        }
    }

    static final class ParseIsNoneOrIsNotNone implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.Compare compare
                    && compare.operators().size() == 1
                    && (compare.operators().get(0) == Expr.CompareOperator.IS
                    || compare.operators().get(0) == Expr.CompareOperator.IS_NOT)
                    && compare.comparators().get(0) instanceof Expr.Constant constant
                    && constant.isNone();
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.Compare compare = (Expr.Compare) node;
            Expression value = parser.parseExpression(compare.left());
            return compare.operators().get(0) == Expr.CompareOperator.IS
                    ? new IsNone(value)
                    : new IsNotNone(value);
        }
    }

    static final class ParseAndOrOr implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.BoolOp;
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.BoolOp boolOp = (Expr.BoolOp) node;
            List<Expression> values = new ArrayList<>();
            for (Expr value : boolOp.values()) {
                values.add(parser.parseExpression(value));
            }
            return boolOp.operator() == Expr.BoolOperator.AND ? new And(values) : new Or(values);
        }
    }

    static final class ParseExpressionWithDeclaration implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.Subscript subscript
                    && subscript.value() instanceof Expr.Tuple tuple
                    && tuple.elements().size() == 2
                    && tuple.elements().get(0) instanceof Expr.NamedExpr
                    && subscript.slice() instanceof Expr.Constant index
                    && BigInteger.ONE.equals(index.value());
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.Tuple tuple = (Expr.Tuple) ((Expr.Subscript) node).value();
            Declaration declaration = (Declaration) parser.parse(tuple.elements().get(0));
            Expression expression = parser.parseExpression(tuple.elements().get(1));
            return new ExpressionWithDeclarations(List.of(declaration), expression);
        }
    }

    static final class ParseDeclaration implements ParseRule {
        @Override
        public boolean matches(Expr node) {
            return node instanceof Expr.NamedExpr;
        }

        @Override
        public TreeNode transform(Expr node, ExpressionParser parser) {
            Expr.NamedExpr namedExpr = (Expr.NamedExpr) node;
            Expression value = parser.parseExpression(namedExpr.value());
            return new Declaration(Identifier.of(namedExpr.target().id()), value);
        }
    }
}
