package org.aascore.codegen.intermediate.hierarchy;

import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.ClassDefinition;
import org.aascore.codegen.parse.DefinitionTable;
import org.aascore.codegen.parse.MethodDefinition;
import org.aascore.codegen.parse.PropertyDefinition;
import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.factory.SortedSets;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.api.set.sorted.MutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Computes the {@link Ontology} of a syntax-level table and checks the
 * constraints that only make sense once the hierarchy is known.
 */
public final class OntologyResolver {

    private static final Logger log = LoggerFactory.getLogger(OntologyResolver.class);

    private static final Comparator<ClassDefinition> BY_NAME = Comparator.comparing(ClassDefinition::name);

    private OntologyResolver() {
        // Static utility class
    }

    /**
     * @throws MetaModelCompileException with a single diagnostic if the inheritance
     *                                   is cyclic, otherwise with every collision and
     *                                   missing-constructor error
     */
    public static Ontology resolve(DefinitionTable table) {
        Ontology ontology = topologicallySort(table);

        List<Diagnostic> errors = new ArrayList<>();
        checkCollisions(table, ontology, errors);
        checkMissingConstructors(table, ontology, errors);

        if (!errors.isEmpty()) {
            log.debug("Ontology has {} error(s)", errors.size());
            throw new MetaModelCompileException(errors);
        }

        log.debug("Resolved the ontology of {} class(es)", ontology.classes().size());
        return ontology;
    }

    /**
     * Depth-first topological sort. Roots are taken in name order and parents
     * in declaration order, so the result depends only on the class names and
     * their inheritances.
     */
    static Ontology topologicallySort(DefinitionTable table) {
        MutableSortedSet<ClassDefinition> withoutPermanentMark = SortedSets.mutable.withAll(BY_NAME, table.classes());
        MutableSet<Identifier> permanentMarks = Sets.mutable.empty();
        MutableSet<Identifier> temporaryMarks = Sets.mutable.empty();
        List<ClassDefinition> result = new ArrayList<>();

        while (!withoutPermanentMark.isEmpty()) {
            ClassDefinition inCycle = visit(
                    withoutPermanentMark.first(), table, withoutPermanentMark, permanentMarks, temporaryMarks, result);
            if (inCycle != null) {
                throw new MetaModelCompileException(inCycle.span(),
                        "Expected no cycles in the inheritance, but the class " + inCycle.name()
                                + " has been observed in a cycle");
            }
        }

        return new Ontology(result, computeAntecedents(result, table));
    }

    /**
     * @return The class entered twice on the current path, or null if there is no cycle
     */
    private static ClassDefinition visit(
            ClassDefinition cls,
            DefinitionTable table,
            MutableSortedSet<ClassDefinition> withoutPermanentMark,
            MutableSet<Identifier> permanentMarks,
            MutableSet<Identifier> temporaryMarks,
            List<ClassDefinition> result) {

        if (permanentMarks.contains(cls.name())) {
            return null;
        }
        if (temporaryMarks.contains(cls.name())) {
            return cls;
        }

        temporaryMarks.add(cls.name());
        for (Identifier parentName : cls.inheritances()) {
            ClassDefinition parent = table.findClass(parentName);
            ClassDefinition inCycle = visit(parent, table, withoutPermanentMark, permanentMarks, temporaryMarks, result);
            if (inCycle != null) {
                return inCycle;
            }
        }
        temporaryMarks.remove(cls.name());

        permanentMarks.add(cls.name());
        withoutPermanentMark.remove(cls);
        result.add(cls);
        return null;
    }

    private static MutableMap<Identifier, MutableList<ClassDefinition>> computeAntecedents(
            List<ClassDefinition> sorted, DefinitionTable table) {
        MutableMap<Identifier, Integer> orderOf = Maps.mutable.empty();
        for (int i = 0; i < sorted.size(); i++) {
            orderOf.put(sorted.get(i).name(), i);
        }

        MutableMap<Identifier, MutableList<ClassDefinition>> antecedentsOf = Maps.mutable.empty();
        for (ClassDefinition cls : sorted) {
            MutableList<ClassDefinition> parents = Lists.mutable.empty();
            for (Identifier parentName : cls.inheritances()) {
                parents.add(table.findClass(parentName));
            }
            parents.sortThisBy(parent -> orderOf.get(parent.name()));

            MutableList<ClassDefinition> antecedents = Lists.mutable.empty();
            MutableSet<Identifier> seen = Sets.mutable.empty();
            for (ClassDefinition parent : parents) {
                for (ClassDefinition antecedent : antecedentsOf.get(parent.name())) {
                    if (seen.add(antecedent.name())) {
                        antecedents.add(antecedent);
                    }
                }
                if (seen.add(parent.name())) {
                    antecedents.add(parent);
                }
            }
            antecedentsOf.put(cls.name(), antecedents);
        }
        return antecedentsOf;
    }

    private static void checkCollisions(DefinitionTable table, Ontology ontology, List<Diagnostic> errors) {
        for (ClassDefinition cls : table.classes()) {
            MutableMap<Identifier, ClassDefinition> observedProperties = Maps.mutable.empty();
            MutableMap<Identifier, ClassDefinition> observedMethods = Maps.mutable.empty();

            for (ClassDefinition antecedent : ontology.antecedentsOf(cls.name())) {
                for (PropertyDefinition property : antecedent.properties()) {
                    observedProperties.putIfAbsent(property.name(), antecedent);
                }
                for (MethodDefinition method : antecedent.methods()) {
                    observedMethods.putIfAbsent(method.name(), antecedent);
                }
            }

            for (PropertyDefinition property : cls.properties()) {
                ClassDefinition antecedent = observedProperties.get(property.name());
                if (antecedent != null) {
                    errors.add(new Diagnostic(property.span(),
                            "The property has already been defined in the antecedent class "
                                    + antecedent.name() + ": " + property.name()));
                }
            }

            for (MethodDefinition method : cls.methods()) {
                if (method.isConstructor()) {
                    continue;
                }
                ClassDefinition antecedent = observedMethods.get(method.name());
                if (antecedent != null) {
                    errors.add(new Diagnostic(method.span(),
                            "The method has already been defined in the antecedent class "
                                    + antecedent.name() + ": " + method.name()));
                }
            }
        }
    }

    private static void checkMissingConstructors(DefinitionTable table, Ontology ontology, List<Diagnostic> errors) {
        for (ClassDefinition cls : table.classes()) {
            if (cls.constructor() != null) {
                continue;
            }

            for (ClassDefinition antecedent : ontology.antecedentsOf(cls.name())) {
                MethodDefinition antecedentInit = antecedent.constructor();
                if (antecedentInit != null && antecedentInit.arguments().size() > 1) {
                    String argumentNames = antecedentInit.arguments().stream()
                            .map(argument -> argument.name().value())
                            .collect(Collectors.joining(", "));
                    errors.add(new Diagnostic(cls.span(),
                            "The class " + cls.name() + " does not specify a constructor, but the antecedent class "
                                    + antecedent.name() + " specifies a constructor with arguments: "
                                    + argumentNames));
                }
            }
        }
    }
}
