package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

import java.util.Objects;

/**
 * A property of a class as written in the meta-model.
 *
 * @param name        Property name
 * @param type        Declared type; for {@code Final[T]} this is {@code T}
 * @param readOnly    Whether the type was wrapped in {@code Final}
 * @param description The docstring following the property, or null
 * @param span        The annotated assignment
 */
public record PropertyDefinition(
        Identifier name,
        TypeExpression type,
        boolean readOnly,
        Description description,
        SourceSpan span) {

    public PropertyDefinition {
        Objects.requireNonNull(name, "Property name cannot be null");
        Objects.requireNonNull(type, "Property type cannot be null");
    }
}
