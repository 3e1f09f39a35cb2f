package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.Description;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * @param name         Enumeration name
 * @param literals     Literals in declaration order
 * @param isSupersetOf Enumerations whose literals all appear in this one
 * @param description  Docstring, or null
 */
public record Enumeration(
        Identifier name,
        List<EnumerationLiteral> literals,
        List<SymbolReference> isSupersetOf,
        Description description,
        SourceSpan span) implements Symbol {

    public Enumeration {
        Objects.requireNonNull(name, "Enumeration name cannot be null");
        literals = List.copyOf(literals);
        isSupersetOf = List.copyOf(isSupersetOf);
    }

    public Optional<EnumerationLiteral> findLiteral(Identifier literalName) {
        return literals.stream()
                .filter(literal -> literal.name().equals(literalName))
                .findFirst();
    }
}
