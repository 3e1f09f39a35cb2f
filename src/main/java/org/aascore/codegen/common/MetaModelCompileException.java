package org.aascore.codegen.common;

import java.util.List;
import java.util.Objects;

/**
 * Exception thrown when a meta-model fails one of the compilation phases.
 *
 * Always carries at least one diagnostic; the exception message is the
 * message of the first one.
 */
public class MetaModelCompileException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public MetaModelCompileException(Diagnostic diagnostic) {
        this(List.of(diagnostic));
    }

    public MetaModelCompileException(List<Diagnostic> diagnostics) {
        super(firstMessage(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public MetaModelCompileException(SourceSpan span, String message) {
        this(new Diagnostic(span, message));
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String firstMessage(List<Diagnostic> diagnostics) {
        Objects.requireNonNull(diagnostics, "Diagnostics cannot be null");
        if (diagnostics.isEmpty()) {
            throw new IllegalArgumentException("A compile exception needs at least one diagnostic");
        }
        return diagnostics.get(0).message();
    }
}
