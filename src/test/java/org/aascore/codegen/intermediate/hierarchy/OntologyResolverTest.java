package org.aascore.codegen.intermediate.hierarchy;

import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.ClassDefinition;
import org.aascore.codegen.parse.DefinitionTable;
import org.aascore.codegen.parse.ModelBuilder;
import org.aascore.codegen.parse.antlr.MetaModelParserAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OntologyResolverTest {

    private static Ontology resolve(String source) {
        DefinitionTable table = new ModelBuilder(new LineIndex(source)).build(MetaModelParserAdapter.parse(source));
        return OntologyResolver.resolve(table);
    }

    private static List<String> names(List<ClassDefinition> classes) {
        return classes.stream().map(cls -> cls.name().value()).collect(Collectors.toList());
    }

    private static final String DIAMOND = """
            class D(B, C):
                pass

            class C(A):
                pass

            class B(A):
                pass

            class A:
                pass
            """;

    @Nested
    @DisplayName("Topological order")
    class Order {

        @Test
        void antecedentsComeBeforeDescendants() {
            Ontology ontology = resolve(DIAMOND);

            for (ClassDefinition cls : ontology.classes()) {
                for (ClassDefinition antecedent : ontology.antecedentsOf(cls.name())) {
                    assertTrue(ontology.orderOf(antecedent.name()) < ontology.orderOf(cls.name()),
                            antecedent.name() + " before " + cls.name());
                }
            }
        }

        @Test
        void diamondListsCommonAncestorOnce() {
            Ontology ontology = resolve(DIAMOND);

            assertEquals(List.of("A", "B", "C"), names(ontology.antecedentsOf(Identifier.of("D"))));
            assertEquals(List.of("A", "B", "C", "D"), names(ontology.classes()));
        }

        @Test
        void descendantsInTopologicalOrder() {
            Ontology ontology = resolve(DIAMOND);

            assertEquals(List.of("B", "C", "D"), names(ontology.descendantsOf(Identifier.of("A"))));
            assertEquals(List.of(), names(ontology.descendantsOf(Identifier.of("D"))));
        }

        @Test
        void orderDoesNotDependOnDeclarationOrder() {
            Ontology declared = resolve("""
                    class Zeta:
                        pass

                    class Alpha:
                        pass

                    class Child(Zeta):
                        pass
                    """);
            Ontology shuffled = resolve("""
                    class Child(Zeta):
                        pass

                    class Alpha:
                        pass

                    class Zeta:
                        pass
                    """);

            assertEquals(names(declared.classes()), names(shuffled.classes()));
            assertEquals(List.of("Alpha", "Zeta", "Child"), names(declared.classes()));
        }

        @Test
        void unknownClassIsNotInTheOntology() {
            Ontology ontology = resolve(DIAMOND);

            assertThrows(NoSuchElementException.class, () -> ontology.antecedentsOf(Identifier.of("E")));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void cycleIsReportedAlone() {
            var error = assertThrows(MetaModelCompileException.class, () -> resolve("""
                    class A(B):
                        x: int

                    class B(A):
                        x: int
                    """));

            assertEquals(1, error.getDiagnostics().size());
            assertEquals("Expected no cycles in the inheritance, but the class A has been observed in a cycle",
                    error.getMessage());
        }

        @Test
        void propertyCollisionNamesTheAntecedent() {
            var error = assertThrows(MetaModelCompileException.class, () -> resolve("""
                    class A:
                        x: int

                    class B(A):
                        x: str
                    """));

            assertEquals("The property has already been defined in the antecedent class A: x", error.getMessage());
        }

        @Test
        void methodCollisionNamesTheAntecedent() {
            var error = assertThrows(MetaModelCompileException.class, () -> resolve("""
                    class A:
                        def f(self) -> None:
                            pass

                    class B(A):
                        def f(self) -> None:
                            pass
                    """));

            assertEquals("The method has already been defined in the antecedent class A: f", error.getMessage());
        }

        @Test
        void missingConstructorNamesBothClasses() {
            var error = assertThrows(MetaModelCompileException.class, () -> resolve("""
                    class A:
                        x: int

                        def __init__(self, x: int) -> None:
                            self.x = x

                    class B(A):
                        pass
                    """));

            assertEquals("The class B does not specify a constructor, but the antecedent class A "
                    + "specifies a constructor with arguments: self, x", error.getMessage());
        }

        @Test
        void parameterlessAntecedentConstructorIsAccepted() {
            Ontology ontology = resolve("""
                    class A:
                        def __init__(self) -> None:
                            pass

                    class B(A):
                        pass
                    """);

            assertEquals(List.of("A"), names(ontology.antecedentsOf(Identifier.of("B"))));
        }

        @Test
        void allCollisionsAreCollected() {
            var error = assertThrows(MetaModelCompileException.class, () -> resolve("""
                    class A:
                        x: int
                        y: int

                    class B(A):
                        x: int

                    class C(A):
                        y: int
                    """));

            assertEquals(List.of(
                    "The property has already been defined in the antecedent class A: x",
                    "The property has already been defined in the antecedent class A: y"),
                    error.getDiagnostics().stream().map(Diagnostic::message).collect(Collectors.toList()));
        }
    }
}
