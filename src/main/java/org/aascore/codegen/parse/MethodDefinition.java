package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.syntax.Stmt;

import java.util.List;
import java.util.Objects;

/**
 * A method of a class as written in the meta-model. The constructor
 * ({@code __init__}) is a method like any other at this stage.
 *
 * @param name                   Method name
 * @param arguments              Arguments, {@code self} first
 * @param returns                Result type, or null if the method returns {@code None}
 * @param description            The leading docstring, or null
 * @param contracts              Pre- and postconditions and snapshots
 * @param implementationSpecific Whether the body is provided per target language
 * @param body                   Statements of the body, never interpreted beyond the constructor
 * @param span                   The function definition
 */
public record MethodDefinition(
        Identifier name,
        List<ArgumentDefinition> arguments,
        TypeExpression returns,
        Description description,
        ContractsDefinition contracts,
        boolean implementationSpecific,
        List<Stmt> body,
        SourceSpan span) {

    public static final Identifier INIT = Identifier.of("__init__");

    public MethodDefinition {
        Objects.requireNonNull(name, "Method name cannot be null");
        arguments = List.copyOf(arguments);
        Objects.requireNonNull(contracts, "Method contracts cannot be null");
        body = List.copyOf(body);
    }

    public boolean isConstructor() {
        return INIT.equals(name);
    }

    /**
     * @return The argument with the given name, or null
     */
    public ArgumentDefinition findArgument(Identifier argumentName) {
        for (ArgumentDefinition argument : arguments) {
            if (argument.name().equals(argumentName)) {
                return argument;
            }
        }
        return null;
    }
}
