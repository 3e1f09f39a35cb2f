package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.Description;

import java.util.Objects;

/**
 * @param name         Property name
 * @param type         Resolved type
 * @param readOnly     Whether the property was declared {@code Final}
 * @param description  Docstring of the property, or null
 * @param specifiedFor The class which declares the property
 * @param span         The declaration
 */
public record Property(
        Identifier name,
        TypeAnnotation type,
        boolean readOnly,
        Description description,
        Identifier specifiedFor,
        SourceSpan span) {

    public Property {
        Objects.requireNonNull(name, "Property name cannot be null");
        Objects.requireNonNull(type, "Property type cannot be null");
        Objects.requireNonNull(specifiedFor, "Declaring class cannot be null");
    }
}
