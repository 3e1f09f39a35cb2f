package org.aascore.codegen.parse.syntax;

import org.aascore.codegen.common.SourceSpan;

import java.util.List;

/**
 * Root of the host syntax tree: the top-level statements of one source document.
 */
public record Module(List<Stmt> body, SourceSpan span) implements SyntaxNode {

    public Module {
        body = List.copyOf(body);
    }
}
