package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.syntax.Expr;

import java.util.Objects;

/**
 * @param name         Argument name
 * @param type         Declared type; {@link TypeExpression.SelfType} for {@code self}
 * @param defaultValue The default as written, or null
 * @param span         The parameter
 */
public record ArgumentDefinition(
        Identifier name,
        TypeExpression type,
        Expr defaultValue,
        SourceSpan span) {

    public ArgumentDefinition {
        Objects.requireNonNull(name, "Argument name cannot be null");
        Objects.requireNonNull(type, "Argument type cannot be null");
    }
}
