package org.aascore.codegen.parse.syntax;

import org.aascore.codegen.common.SourceSpan;

/**
 * A node of the host syntax tree; every node knows where it came from.
 */
public interface SyntaxNode {

    SourceSpan span();
}
