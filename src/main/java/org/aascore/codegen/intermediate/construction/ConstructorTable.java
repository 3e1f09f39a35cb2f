package org.aascore.codegen.intermediate.construction;

import org.aascore.codegen.common.Identifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Statements of the constructor of every class, keyed by class name.
 *
 * @param <S> The kind of statements held; understood constructors may delegate
 *            to a parent, in-lined constructors only assign
 */
public final class ConstructorTable<S extends ConstructorStatement> {

    private final Map<Identifier, List<S>> statements;

    public ConstructorTable(Map<Identifier, List<S>> statements) {
        Map<Identifier, List<S>> copy = new LinkedHashMap<>();
        statements.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        this.statements = Collections.unmodifiableMap(copy);
    }

    public boolean has(Identifier className) {
        return statements.containsKey(className);
    }

    /**
     * @throws NoSuchElementException if the class has no entry
     */
    public List<S> mustFind(Identifier className) {
        List<S> result = statements.get(className);
        if (result == null) {
            throw new NoSuchElementException("No entry found in the constructor table for the class: " + className);
        }
        return result;
    }

    /**
     * @return The entries in the order the classes were processed
     */
    public Map<Identifier, List<S>> entries() {
        return statements;
    }
}
