package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.tree.Expression;

import java.util.List;
import java.util.Objects;

public record Snapshot(List<Identifier> args, Expression capture, Identifier name, SourceSpan span) {

    public Snapshot {
        args = List.copyOf(args);
        Objects.requireNonNull(capture, "Snapshot capture cannot be null");
        Objects.requireNonNull(name, "Snapshot name cannot be null");
    }
}
