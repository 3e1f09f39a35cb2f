package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;

import java.util.List;
import java.util.Objects;

/**
 * A structured type as written in the meta-model.
 *
 * @param name                   Class name
 * @param kind                   Abstract or concrete
 * @param implementationSpecific Whether the whole class is provided per target language
 * @param inheritances           Direct parents in declaration order
 * @param properties             Own properties in declaration order
 * @param methods                Own methods in declaration order, including {@code __init__}
 * @param invariants             Invariants in decorator order
 * @param jsonSerialization      JSON settings, or null if not marked
 * @param xmlSerialization       XML settings, or null if not marked
 * @param description            The leading docstring, or null
 * @param span                   The class definition
 */
public record ClassDefinition(
        Identifier name,
        ClassKind kind,
        boolean implementationSpecific,
        List<Identifier> inheritances,
        List<PropertyDefinition> properties,
        List<MethodDefinition> methods,
        List<InvariantDefinition> invariants,
        JsonSerialization jsonSerialization,
        XmlSerialization xmlSerialization,
        Description description,
        SourceSpan span) implements Definition {

    public ClassDefinition {
        Objects.requireNonNull(name, "Class name cannot be null");
        Objects.requireNonNull(kind, "Class kind cannot be null");
        inheritances = List.copyOf(inheritances);
        properties = List.copyOf(properties);
        methods = List.copyOf(methods);
        invariants = List.copyOf(invariants);
    }

    public boolean isAbstract() {
        return kind == ClassKind.ABSTRACT;
    }

    public PropertyDefinition findProperty(Identifier propertyName) {
        for (PropertyDefinition property : properties) {
            if (property.name().equals(propertyName)) {
                return property;
            }
        }
        return null;
    }

    public MethodDefinition findMethod(Identifier methodName) {
        for (MethodDefinition method : methods) {
            if (method.name().equals(methodName)) {
                return method;
            }
        }
        return null;
    }

    /**
     * @return The explicit {@code __init__}, or null
     */
    public MethodDefinition constructor() {
        return findMethod(MethodDefinition.INIT);
    }
}
