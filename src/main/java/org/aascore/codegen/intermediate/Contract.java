package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.tree.Expression;

import java.util.List;
import java.util.Objects;

/**
 * A pre- or postcondition.
 *
 * @param args        Names the condition refers to
 * @param condition   The condition as an expression tree
 * @param description Optional explanation, or null
 */
public record Contract(List<Identifier> args, Expression condition, String description, SourceSpan span) {

    public Contract {
        args = List.copyOf(args);
        Objects.requireNonNull(condition, "Contract condition cannot be null");
    }
}
