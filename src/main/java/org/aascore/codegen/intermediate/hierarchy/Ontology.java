package org.aascore.codegen.intermediate.hierarchy;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.parse.ClassDefinition;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * The inheritance hierarchy of the classes of a meta-model.
 *
 * <p>Classes are kept in topological order: every class comes after all of
 * its antecedents. The antecedents of a class are its transitive parents,
 * each listed once, supertypes before subtypes; descendants are listed in
 * topological order as well.
 */
public final class Ontology {

    private final ImmutableList<ClassDefinition> classes;
    private final ImmutableMap<Identifier, Integer> orderOf;
    private final ImmutableMap<Identifier, ImmutableList<ClassDefinition>> antecedentsOf;
    private final ImmutableMap<Identifier, ImmutableList<ClassDefinition>> descendantsOf;

    Ontology(List<ClassDefinition> classes, MutableMap<Identifier, MutableList<ClassDefinition>> antecedents) {
        this.classes = Lists.immutable.withAll(classes);

        MutableMap<Identifier, Integer> order = Maps.mutable.empty();
        MutableMap<Identifier, MutableList<ClassDefinition>> descendants = Maps.mutable.empty();
        for (int i = 0; i < classes.size(); i++) {
            order.put(classes.get(i).name(), i);
            descendants.put(classes.get(i).name(), Lists.mutable.empty());
        }
        for (ClassDefinition cls : classes) {
            for (ClassDefinition antecedent : antecedents.get(cls.name())) {
                descendants.get(antecedent.name()).add(cls);
            }
        }

        this.orderOf = order.toImmutable();
        this.antecedentsOf = antecedents.collectValues((name, list) -> list.toImmutable()).toImmutable();
        this.descendantsOf = descendants.collectValues((name, list) -> list.toImmutable()).toImmutable();
    }

    /**
     * @return All classes in topological order
     */
    public List<ClassDefinition> classes() {
        return classes.castToList();
    }

    public List<ClassDefinition> antecedentsOf(Identifier name) {
        return lookup(antecedentsOf, name).castToList();
    }

    public List<ClassDefinition> descendantsOf(Identifier name) {
        return lookup(descendantsOf, name).castToList();
    }

    /**
     * @return Position of the class in the topological order
     */
    public int orderOf(Identifier name) {
        Integer order = orderOf.get(name);
        if (order == null) {
            throw new NoSuchElementException("No class in the ontology: " + name);
        }
        return order;
    }

    private static ImmutableList<ClassDefinition> lookup(
            ImmutableMap<Identifier, ImmutableList<ClassDefinition>> map, Identifier name) {
        ImmutableList<ClassDefinition> result = map.get(name);
        if (result == null) {
            throw new NoSuchElementException("No class in the ontology: " + name);
        }
        return result;
    }
}
