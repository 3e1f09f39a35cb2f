package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.tree.Expression;

import java.util.List;
import java.util.Objects;

/**
 * A value captured before a method runs, available to postconditions as {@code OLD.<name>}.
 *
 * @param args    Arguments of the capture lambda
 * @param capture Body of the capture lambda
 * @param name    Name under which the value is captured
 * @param span    The decorator
 */
public record SnapshotDefinition(
        List<Identifier> args,
        Expression capture,
        Identifier name,
        SourceSpan span) {

    public SnapshotDefinition {
        args = List.copyOf(args);
        Objects.requireNonNull(capture, "Snapshot capture cannot be null");
        Objects.requireNonNull(name, "Snapshot name cannot be null");
    }
}
