package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.tree.Expression;

import java.util.List;
import java.util.Objects;

/**
 * A pre- or postcondition of a method.
 *
 * @param args        Arguments of the condition lambda
 * @param condition   Body of the condition lambda
 * @param description Optional explanation, or null
 * @param span        The decorator
 */
public record ContractDefinition(
        List<Identifier> args,
        Expression condition,
        String description,
        SourceSpan span) {

    public ContractDefinition {
        args = List.copyOf(args);
        Objects.requireNonNull(condition, "Contract condition cannot be null");
    }
}
