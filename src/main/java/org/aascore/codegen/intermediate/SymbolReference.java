package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;

import java.util.Objects;

/**
 * A reference to a symbol by name which is bound once the symbol has been
 * built. All references to the same name share one instance, so binding it
 * once binds every use.
 *
 * <p>Equality is identity; two references are the same only if they are the
 * shared instance for one name.
 */
public final class SymbolReference {

    private final Identifier name;
    private Symbol symbol;

    SymbolReference(Identifier name) {
        this.name = Objects.requireNonNull(name, "Referenced name cannot be null");
    }

    public Identifier name() {
        return name;
    }

    public boolean isResolved() {
        return symbol != null;
    }

    /**
     * @throws IllegalStateException if the reference has not been bound yet
     */
    public Symbol symbol() {
        if (symbol == null) {
            throw new IllegalStateException("The reference to " + name + " has not been resolved");
        }
        return symbol;
    }

    void resolve(Symbol target) {
        Objects.requireNonNull(target, "Referenced symbol cannot be null");
        if (symbol != null) {
            throw new IllegalStateException("The reference to " + name + " has already been resolved");
        }
        if (!target.name().equals(name)) {
            throw new IllegalArgumentException("Expected a symbol named " + name + ", but got: " + target.name());
        }
        symbol = target;
    }

    @Override
    public String toString() {
        return name.value();
    }
}
