package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.Description;
import org.aascore.codegen.parse.syntax.Stmt;

import java.util.List;
import java.util.Objects;

/**
 * A method of a class. The body is kept for generators which transpile it;
 * it is never interpreted here.
 *
 * @param name                   Method name
 * @param arguments              Arguments without {@code self}
 * @param returns                Result type, or null if the method returns nothing
 * @param description            Docstring, or null
 * @param contracts              Pre- and postconditions and snapshots
 * @param implementationSpecific Whether the body is provided per target language
 * @param specifiedFor           The class which declares the method
 * @param body                   Statements of the body after the docstring
 */
public record Method(
        Identifier name,
        List<Argument> arguments,
        TypeAnnotation returns,
        Description description,
        Contracts contracts,
        boolean implementationSpecific,
        Identifier specifiedFor,
        List<Stmt> body,
        SourceSpan span) {

    public Method {
        Objects.requireNonNull(name, "Method name cannot be null");
        arguments = List.copyOf(arguments);
        Objects.requireNonNull(contracts, "Method contracts cannot be null");
        Objects.requireNonNull(specifiedFor, "Declaring class cannot be null");
        body = List.copyOf(body);
    }

    /**
     * @return Key under which target-specific code for this method is looked up
     */
    public String implementationKey() {
        return specifiedFor.value() + "." + name.value();
    }
}
