package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.tree.Expression;

import java.util.Objects;

/**
 * @param description  Optional explanation, or null
 * @param condition    Condition over {@code self}
 * @param specifiedFor The class which declares the invariant
 */
public record Invariant(String description, Expression condition, Identifier specifiedFor, SourceSpan span) {

    public Invariant {
        Objects.requireNonNull(condition, "Invariant condition cannot be null");
        Objects.requireNonNull(specifiedFor, "Declaring class cannot be null");
    }
}
