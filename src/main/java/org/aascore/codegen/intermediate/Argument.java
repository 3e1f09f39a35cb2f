package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

import java.util.Objects;

/**
 * @param defaultValue The default, or null if the argument is required
 */
public record Argument(Identifier name, TypeAnnotation type, Default defaultValue, SourceSpan span) {

    public Argument {
        Objects.requireNonNull(name, "Argument name cannot be null");
        Objects.requireNonNull(type, "Argument type cannot be null");
    }
}
