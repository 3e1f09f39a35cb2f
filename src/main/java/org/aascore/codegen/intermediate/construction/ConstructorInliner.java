package org.aascore.codegen.intermediate.construction;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.intermediate.hierarchy.Ontology;
import org.aascore.codegen.parse.ClassDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens constructors along the inheritance chain: every call to a parent
 * constructor is replaced by the parent's already flattened assignments.
 *
 * <p>An assignment inherited through several parents, as in a diamond, is kept
 * only at its first occurrence. Assignments written in a class itself are never
 * merged, so a property assigned twice there is still reported by the translator.
 */
public final class ConstructorInliner {

    private ConstructorInliner() {
        // Static utility class
    }

    /**
     * @param understood Understood constructors of all classes
     * @param ontology   Supplies the order in which parents come before their children
     * @return Per class, the assignments only, in execution order
     */
    public static ConstructorTable<ConstructorStatement.AssignArgument> inline(
            ConstructorTable<ConstructorStatement> understood, Ontology ontology) {

        Map<Identifier, List<ConstructorStatement.AssignArgument>> inlined = new LinkedHashMap<>();

        for (ClassDefinition cls : ontology.classes()) {
            List<ConstructorStatement.AssignArgument> flat = new ArrayList<>();
            for (ConstructorStatement statement : understood.mustFind(cls.name())) {
                if (statement instanceof ConstructorStatement.CallSuperConstructor call) {
                    // A shared ancestor reached over two parents contributes its assignments once.
                    for (ConstructorStatement.AssignArgument inherited : inlined.get(call.superName())) {
                        if (!flat.contains(inherited)) {
                            flat.add(inherited);
                        }
                    }
                } else if (statement instanceof ConstructorStatement.AssignArgument assign) {
                    flat.add(assign);
                }
            }
            inlined.put(cls.name(), flat);
        }

        return new ConstructorTable<>(inlined);
    }
}
