package org.aascore.codegen.parse.syntax;

import org.aascore.codegen.common.SourceSpan;

import java.util.List;

/**
 * The parameter list of a function definition or a lambda.
 *
 * @param positionalOnly Parameters before a {@code /} marker
 * @param args           Ordinary parameters
 * @param varArg         The {@code *args} parameter, or null
 * @param keywordOnly    Parameters after {@code *} or {@code *args}
 * @param kwArg          The {@code **kwargs} parameter, or null
 */
public record Arguments(
        List<Parameter> positionalOnly,
        List<Parameter> args,
        Parameter varArg,
        List<Parameter> keywordOnly,
        Parameter kwArg,
        SourceSpan span) implements SyntaxNode {

    public Arguments {
        positionalOnly = List.copyOf(positionalOnly);
        args = List.copyOf(args);
        keywordOnly = List.copyOf(keywordOnly);
    }

    public static Arguments empty(SourceSpan span) {
        return new Arguments(List.of(), List.of(), null, List.of(), null, span);
    }

    /**
     * A single parameter; annotation and default value are null when absent.
     */
    public record Parameter(String name, Expr annotation, Expr defaultValue, SourceSpan span)
            implements SyntaxNode {
    }
}
