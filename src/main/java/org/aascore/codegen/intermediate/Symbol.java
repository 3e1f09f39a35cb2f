package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.Description;

/**
 * An entry of the final symbol table.
 */
public sealed interface Symbol permits Enumeration, ModelClass {

    Identifier name();

    Description description();

    SourceSpan span();
}
