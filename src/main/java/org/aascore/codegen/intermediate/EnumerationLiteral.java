package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.Description;

import java.util.Objects;

public record EnumerationLiteral(Identifier name, String value, Description description, SourceSpan span) {

    public EnumerationLiteral {
        Objects.requireNonNull(name, "Literal name cannot be null");
        Objects.requireNonNull(value, "Literal value cannot be null");
    }
}
