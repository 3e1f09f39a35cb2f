package org.aascore.codegen.intermediate;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.ClassKind;
import org.aascore.codegen.parse.Description;
import org.aascore.codegen.parse.JsonSerialization;
import org.aascore.codegen.parse.XmlSerialization;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A class of the meta-model with everything it inherits stacked in.
 *
 * <p>This is named ModelClass to avoid collision with java.lang.Class.
 *
 * @param name                   Class name
 * @param kind                   Abstract or concrete
 * @param implementationSpecific Whether the whole class is provided per target language
 * @param parents                Direct parents in declaration order
 * @param antecedents            All transitive parents, supertypes first
 * @param concreteDescendants    Concrete classes inheriting from this one, in topological order
 * @param properties             Inherited properties followed by the own ones
 * @param methods                Inherited methods followed by the own ones, constructor excluded
 * @param constructor            The flattened constructor
 * @param invariants             Inherited invariants followed by the own ones
 * @param jsonSerialization      JSON settings
 * @param xmlSerialization       XML settings
 * @param description            Docstring, or null
 * @param span                   The class definition
 */
public record ModelClass(
        Identifier name,
        ClassKind kind,
        boolean implementationSpecific,
        List<SymbolReference> parents,
        List<SymbolReference> antecedents,
        List<SymbolReference> concreteDescendants,
        List<Property> properties,
        List<Method> methods,
        Constructor constructor,
        List<Invariant> invariants,
        JsonSerialization jsonSerialization,
        XmlSerialization xmlSerialization,
        Description description,
        SourceSpan span) implements Symbol {

    public ModelClass {
        Objects.requireNonNull(name, "Class name cannot be null");
        Objects.requireNonNull(kind, "Class kind cannot be null");
        parents = List.copyOf(parents);
        antecedents = List.copyOf(antecedents);
        concreteDescendants = List.copyOf(concreteDescendants);
        properties = List.copyOf(properties);
        methods = List.copyOf(methods);
        Objects.requireNonNull(constructor, "Constructor cannot be null");
        invariants = List.copyOf(invariants);
        Objects.requireNonNull(jsonSerialization, "JSON serialization cannot be null");
        Objects.requireNonNull(xmlSerialization, "XML serialization cannot be null");
    }

    public boolean isAbstract() {
        return kind == ClassKind.ABSTRACT;
    }

    public Optional<Property> findProperty(Identifier propertyName) {
        return properties.stream()
                .filter(p -> p.name().equals(propertyName))
                .findFirst();
    }

    public Optional<Method> findMethod(Identifier methodName) {
        return methods.stream()
                .filter(m -> m.name().equals(methodName))
                .findFirst();
    }

    public List<ModelClass> parentClasses() {
        return classesOf(parents);
    }

    public List<ModelClass> antecedentClasses() {
        return classesOf(antecedents);
    }

    public List<ModelClass> concreteDescendantClasses() {
        return classesOf(concreteDescendants);
    }

    /**
     * @return Key under which the target-specific code of an implementation-specific class is looked up
     */
    public String implementationKey() {
        return name.value();
    }

    public String constructorImplementationKey() {
        return name.value() + ".__init__";
    }

    private static List<ModelClass> classesOf(List<SymbolReference> references) {
        return references.stream()
                .map(reference -> (ModelClass) reference.symbol())
                .collect(Collectors.toList());
    }
}
