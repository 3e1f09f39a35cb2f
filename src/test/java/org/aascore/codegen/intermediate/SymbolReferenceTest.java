package org.aascore.codegen.intermediate;

import org.aascore.codegen.MetaModelCompiler;
import org.aascore.codegen.MetaModelFixtures;
import org.aascore.codegen.common.Identifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolReferenceTest {

    private static Enumeration enumeration(String name) {
        return new Enumeration(Identifier.of(name), List.of(), List.of(), null, null);
    }

    @Test
    void bindsExactlyOnce() {
        var reference = new SymbolReference(Identifier.of("Kind"));
        assertFalse(reference.isResolved());
        assertThrows(IllegalStateException.class, reference::symbol);

        Enumeration kind = enumeration("Kind");
        reference.resolve(kind);

        assertTrue(reference.isResolved());
        assertSame(kind, reference.symbol());
        assertThrows(IllegalStateException.class, () -> reference.resolve(enumeration("Kind")));
    }

    @Test
    void rejectsSymbolOfAnotherName() {
        var reference = new SymbolReference(Identifier.of("Kind"));

        assertThrows(IllegalArgumentException.class, () -> reference.resolve(enumeration("Other")));
        assertFalse(reference.isResolved());
    }

    @Test
    void compiledTableHoldsOnlyResolvedReferences() {
        SymbolTable table = new MetaModelCompiler().compile(MetaModelFixtures.SAMPLE);

        for (ModelClass cls : table.classes()) {
            cls.antecedents().forEach(reference -> assertTrue(reference.isResolved(), reference.toString()));
            cls.concreteDescendants().forEach(reference -> assertTrue(reference.isResolved(), reference.toString()));
            for (Property property : cls.properties()) {
                if (property.type() instanceof TypeAnnotation.OurType ourType) {
                    assertTrue(ourType.reference().isResolved(), property.name().value());
                }
            }
        }
    }
}
