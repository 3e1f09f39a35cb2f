package org.aascore.codegen.common;

import java.util.List;
import java.util.Objects;

/**
 * A compilation error with an optional source position and nested causes.
 *
 * @param span       Where the error occurred, or null if it concerns the whole input
 * @param message    Human-readable message
 * @param underlying Errors that explain this one, in the order they were found
 */
public record Diagnostic(SourceSpan span, String message, List<Diagnostic> underlying) {

    public Diagnostic {
        Objects.requireNonNull(message, "Diagnostic message cannot be null");
        underlying = underlying == null ? List.of() : List.copyOf(underlying);
    }

    public Diagnostic(SourceSpan span, String message) {
        this(span, message, List.of());
    }

    public boolean hasSpan() {
        return span != null;
    }
}
