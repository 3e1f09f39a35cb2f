package org.aascore.codegen.intermediate;

import org.aascore.codegen.intermediate.construction.ConstructorStatement;

import java.util.List;

/**
 * The flattened constructor of a class.
 *
 * @param arguments              Arguments of the class' own {@code __init__}, without {@code self}
 * @param contracts              Contracts of the antecedents' constructors followed by the own ones
 * @param statements             Assignments in execution order, inherited ones included
 * @param implementationSpecific Whether the own {@code __init__} is provided per target language
 */
public record Constructor(
        List<Argument> arguments,
        Contracts contracts,
        List<ConstructorStatement.AssignArgument> statements,
        boolean implementationSpecific) {

    public Constructor {
        arguments = List.copyOf(arguments);
        statements = List.copyOf(statements);
    }
}
