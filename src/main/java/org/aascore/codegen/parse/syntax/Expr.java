package org.aascore.codegen.parse.syntax;

import org.aascore.codegen.common.SourceSpan;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Expressions of the host grammar.
 */
public sealed interface Expr extends SyntaxNode {

    record Name(String id, SourceSpan span) implements Expr {
    }

    /**
     * A literal: {@code null} for None, or a Boolean, BigInteger, Double or String.
     */
    record Constant(Object value, SourceSpan span) implements Expr {

        public Constant {
            if (value != null
                    && !(value instanceof Boolean)
                    && !(value instanceof BigInteger)
                    && !(value instanceof Double)
                    && !(value instanceof String)) {
                throw new IllegalArgumentException("Unsupported constant value: " + value.getClass());
            }
        }

        public boolean isNone() {
            return value == null;
        }

        public boolean isString() {
            return value instanceof String;
        }
    }

    record Ellipsis(SourceSpan span) implements Expr {
    }

    record Attribute(Expr value, String attr, SourceSpan span) implements Expr {
    }

    record Call(Expr func, List<Expr> args, List<Keyword> keywords, SourceSpan span) implements Expr {

        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }
    }

    /**
     * A keyword argument of a call; {@code arg} is null for {@code **mapping}.
     */
    record Keyword(String arg, Expr value, SourceSpan span) implements SyntaxNode {
    }

    record Subscript(Expr value, Expr slice, SourceSpan span) implements Expr {
    }

    record Slice(Expr lower, Expr upper, Expr step, SourceSpan span) implements Expr {
    }

    record Tuple(List<Expr> elements, SourceSpan span) implements Expr {

        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    record ListDisplay(List<Expr> elements, SourceSpan span) implements Expr {

        public ListDisplay {
            elements = List.copyOf(elements);
        }
    }

    record SetDisplay(List<Expr> elements, SourceSpan span) implements Expr {

        public SetDisplay {
            elements = List.copyOf(elements);
        }
    }

    /**
     * A dict display; a null key marks a {@code **mapping} entry.
     */
    record DictDisplay(List<Expr> keys, List<Expr> values, SourceSpan span) implements Expr {

        public DictDisplay {
            keys = Collections.unmodifiableList(new ArrayList<>(keys));
            values = List.copyOf(values);
        }
    }

    record Compare(Expr left, List<CompareOperator> operators, List<Expr> comparators, SourceSpan span)
            implements Expr {

        public Compare {
            operators = List.copyOf(operators);
            comparators = List.copyOf(comparators);
            if (operators.size() != comparators.size()) {
                throw new IllegalArgumentException("Each comparison operator needs a comparator");
            }
        }
    }

    /**
     * {@code and} / {@code or} over two or more values; chains of the same
     * operator are flattened into one node.
     */
    record BoolOp(BoolOperator operator, List<Expr> values, SourceSpan span) implements Expr {

        public BoolOp {
            values = List.copyOf(values);
        }
    }

    record UnaryOp(UnaryOperator operator, Expr operand, SourceSpan span) implements Expr {
    }

    record BinOp(Expr left, BinaryOperator operator, Expr right, SourceSpan span) implements Expr {
    }

    record Lambda(Arguments args, Expr body, SourceSpan span) implements Expr {
    }

    record IfExp(Expr test, Expr body, Expr orElse, SourceSpan span) implements Expr {
    }

    /**
     * The walrus assignment {@code target := value}.
     */
    record NamedExpr(Name target, Expr value, SourceSpan span) implements Expr {
    }

    record Starred(Expr value, SourceSpan span) implements Expr {
    }

    /**
     * List, set, dict comprehensions and generator expressions. For dict
     * comprehensions {@code element} is the key and {@code value} the value;
     * otherwise {@code value} is null.
     */
    record Comprehension(ComprehensionKind kind, Expr element, Expr value, List<ComprehensionClause> clauses,
                         SourceSpan span) implements Expr {

        public Comprehension {
            clauses = List.copyOf(clauses);
        }
    }

    record ComprehensionClause(Expr target, Expr iterable, List<Expr> conditions, SourceSpan span)
            implements SyntaxNode {

        public ComprehensionClause {
            conditions = List.copyOf(conditions);
        }
    }

    enum ComprehensionKind {
        LIST, SET, DICT, GENERATOR
    }

    enum CompareOperator {
        LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!="),
        IN("in"), NOT_IN("not in"), IS("is"), IS_NOT("is not");

        private final String symbol;

        CompareOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum BoolOperator {
        AND, OR
    }

    enum UnaryOperator {
        NOT, PLUS, MINUS, INVERT
    }

    enum BinaryOperator {
        ADD("+"), SUB("-"), MULT("*"), MAT_MULT("@"), DIV("/"), FLOOR_DIV("//"), MOD("%"), POW("**"),
        LSHIFT("<<"), RSHIFT(">>"), BIT_OR("|"), BIT_XOR("^"), BIT_AND("&");

        private final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static BinaryOperator fromSymbol(String symbol) {
            for (BinaryOperator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown binary operator: " + symbol);
        }
    }
}
