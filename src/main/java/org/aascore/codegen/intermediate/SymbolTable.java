package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The validated, immutable registry of all symbols of a meta-model, handed to
 * code generators.
 */
public final class SymbolTable {

    private final List<Symbol> symbols;
    private final Map<Identifier, Symbol> byName;

    SymbolTable(List<Symbol> symbols) {
        this.symbols = List.copyOf(symbols);
        Map<Identifier, Symbol> map = new LinkedHashMap<>();
        for (Symbol symbol : this.symbols) {
            if (map.putIfAbsent(symbol.name(), symbol) != null) {
                throw new IllegalArgumentException("Duplicate symbol: " + symbol.name());
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    /**
     * @return All symbols in declaration order
     */
    public List<Symbol> symbols() {
        return symbols;
    }

    public Optional<Symbol> find(Identifier name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * @throws IllegalArgumentException if there is no symbol with the given name
     */
    public Symbol mustFind(Identifier name) {
        Symbol symbol = byName.get(name);
        if (symbol == null) {
            throw new IllegalArgumentException("Symbol '" + name + "' not found in the symbol table");
        }
        return symbol;
    }

    /**
     * @throws IllegalArgumentException if there is no class with the given name
     */
    public ModelClass mustFindClass(Identifier name) {
        if (mustFind(name) instanceof ModelClass cls) {
            return cls;
        }
        throw new IllegalArgumentException("Symbol '" + name + "' is not a class");
    }

    /**
     * @throws IllegalArgumentException if there is no enumeration with the given name
     */
    public Enumeration mustFindEnumeration(Identifier name) {
        if (mustFind(name) instanceof Enumeration enumeration) {
            return enumeration;
        }
        throw new IllegalArgumentException("Symbol '" + name + "' is not an enumeration");
    }

    public List<Enumeration> enumerations() {
        return symbols.stream()
                .filter(Enumeration.class::isInstance)
                .map(Enumeration.class::cast)
                .collect(Collectors.toList());
    }

    public List<ModelClass> classes() {
        return symbols.stream()
                .filter(ModelClass.class::isInstance)
                .map(ModelClass.class::cast)
                .collect(Collectors.toList());
    }

    public List<ModelClass> concreteClasses() {
        return classes().stream()
                .filter(cls -> !cls.isAbstract())
                .collect(Collectors.toList());
    }

    public List<ModelClass> abstractClasses() {
        return classes().stream()
                .filter(ModelClass::isAbstract)
                .collect(Collectors.toList());
    }
}
