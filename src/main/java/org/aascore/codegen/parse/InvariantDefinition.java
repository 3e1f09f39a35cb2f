package org.aascore.codegen.parse;

import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.tree.Expression;

import java.util.Objects;

/**
 * @param description Optional explanation, or null
 * @param condition   Body of the invariant lambda over {@code self}
 * @param span        The decorator
 */
public record InvariantDefinition(String description, Expression condition, SourceSpan span) {

    public InvariantDefinition {
        Objects.requireNonNull(condition, "Invariant condition cannot be null");
    }
}
