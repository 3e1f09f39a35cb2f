package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The syntax-level symbol table: every definition of the meta-model, in
 * declaration order, with unique names.
 */
public final class DefinitionTable {

    private final List<Definition> definitions;
    private final Map<Identifier, Definition> byName;

    public DefinitionTable(List<Definition> definitions) {
        this.definitions = List.copyOf(definitions);
        Map<Identifier, Definition> map = new LinkedHashMap<>();
        for (Definition definition : this.definitions) {
            if (map.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate definition: " + definition.name());
            }
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public List<Definition> definitions() {
        return definitions;
    }

    /**
     * @return The definition with the given name, or null
     */
    public Definition find(Identifier name) {
        return byName.get(name);
    }

    public ClassDefinition findClass(Identifier name) {
        return byName.get(name) instanceof ClassDefinition cls ? cls : null;
    }

    public EnumerationDefinition findEnumeration(Identifier name) {
        return byName.get(name) instanceof EnumerationDefinition enumeration ? enumeration : null;
    }

    public List<ClassDefinition> classes() {
        List<ClassDefinition> classes = new ArrayList<>();
        for (Definition definition : definitions) {
            if (definition instanceof ClassDefinition cls) {
                classes.add(cls);
            }
        }
        return classes;
    }

    public List<EnumerationDefinition> enumerations() {
        List<EnumerationDefinition> enumerations = new ArrayList<>();
        for (Definition definition : definitions) {
            if (definition instanceof EnumerationDefinition enumeration) {
                enumerations.add(enumeration);
            }
        }
        return enumerations;
    }
}
