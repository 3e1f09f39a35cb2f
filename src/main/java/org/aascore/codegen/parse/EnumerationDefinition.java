package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

import java.util.List;
import java.util.Objects;

/**
 * @param name         Enumeration name
 * @param isSupersetOf Enumerations whose literals this one contains
 * @param literals     Literals in declaration order
 * @param description  The leading docstring, or null
 * @param span         The class definition
 */
public record EnumerationDefinition(
        Identifier name,
        List<Identifier> isSupersetOf,
        List<EnumerationLiteralDefinition> literals,
        Description description,
        SourceSpan span) implements Definition {

    public EnumerationDefinition {
        Objects.requireNonNull(name, "Enumeration name cannot be null");
        isSupersetOf = List.copyOf(isSupersetOf);
        literals = List.copyOf(literals);
    }

    public EnumerationLiteralDefinition findLiteral(Identifier literalName) {
        for (EnumerationLiteralDefinition literal : literals) {
            if (literal.name().equals(literalName)) {
                return literal;
            }
        }
        return null;
    }
}
