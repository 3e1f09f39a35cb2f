package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

import java.util.Objects;

public record EnumerationLiteralDefinition(
        Identifier name,
        String value,
        Description description,
        SourceSpan span) {

    public EnumerationLiteralDefinition {
        Objects.requireNonNull(name, "Literal name cannot be null");
        Objects.requireNonNull(value, "Literal value cannot be null");
    }
}
