package org.aascore.codegen.parse.syntax;

import org.aascore.codegen.common.SourceSpan;

import java.util.List;

/**
 * Statements of the host grammar.
 */
public sealed interface Stmt extends SyntaxNode {

    record ClassDef(String name, List<Expr> bases, List<Expr.Keyword> keywords, List<Expr> decorators,
                    List<Stmt> body, SourceSpan span) implements Stmt {

        public ClassDef {
            bases = List.copyOf(bases);
            keywords = List.copyOf(keywords);
            decorators = List.copyOf(decorators);
            body = List.copyOf(body);
        }
    }

    /**
     * A function definition; {@code returns} is null when there is no return annotation.
     */
    record FunctionDef(String name, Arguments args, Expr returns, List<Expr> decorators, List<Stmt> body,
                       SourceSpan span) implements Stmt {

        public FunctionDef {
            decorators = List.copyOf(decorators);
            body = List.copyOf(body);
        }
    }

    record Pass(SourceSpan span) implements Stmt {
    }

    record Break(SourceSpan span) implements Stmt {
    }

    record Continue(SourceSpan span) implements Stmt {
    }

    record ExprStmt(Expr value, SourceSpan span) implements Stmt {
    }

    /**
     * {@code a = b = value} has the targets {@code [a, b]}.
     */
    record Assign(List<Expr> targets, Expr value, SourceSpan span) implements Stmt {

        public Assign {
            targets = List.copyOf(targets);
        }
    }

    /**
     * {@code target: annotation = value}; {@code simple} is false when the
     * target is not a bare name or is parenthesized.
     */
    record AnnAssign(Expr target, Expr annotation, Expr value, boolean simple, SourceSpan span)
            implements Stmt {
    }

    record AugAssign(Expr target, Expr.BinaryOperator operator, Expr value, SourceSpan span) implements Stmt {
    }

    record Return(Expr value, SourceSpan span) implements Stmt {
    }

    record Raise(Expr exception, Expr cause, SourceSpan span) implements Stmt {
    }

    record Assert(Expr test, Expr message, SourceSpan span) implements Stmt {
    }

    /**
     * {@code elif} branches are nested {@code If} statements in {@code orElse}.
     */
    record If(Expr test, List<Stmt> body, List<Stmt> orElse, SourceSpan span) implements Stmt {

        public If {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record While(Expr test, List<Stmt> body, List<Stmt> orElse, SourceSpan span) implements Stmt {

        public While {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record For(Expr target, Expr iterable, List<Stmt> body, List<Stmt> orElse, SourceSpan span)
            implements Stmt {

        public For {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }
    }

    record Import(List<Alias> names, SourceSpan span) implements Stmt {

        public Import {
            names = List.copyOf(names);
        }
    }

    /**
     * {@code from module import names}; {@code level} counts leading dots and
     * {@code module} is null for {@code from . import x}.
     */
    record ImportFrom(String module, List<Alias> names, int level, SourceSpan span) implements Stmt {

        public ImportFrom {
            names = List.copyOf(names);
        }
    }

    /**
     * An imported name with its optional {@code as} alias (null when absent).
     */
    record Alias(String name, String asName, SourceSpan span) implements SyntaxNode {
    }
}
