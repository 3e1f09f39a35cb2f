package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

/**
 * A top-level entity of the meta-model. Other entities are referenced by name only.
 */
public sealed interface Definition permits ClassDefinition, EnumerationDefinition {

    Identifier name();

    Description description();

    SourceSpan span();
}
