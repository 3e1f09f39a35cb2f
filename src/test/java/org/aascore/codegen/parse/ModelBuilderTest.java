package org.aascore.codegen.parse;

import org.aascore.codegen.MetaModelFixtures;
import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.antlr.MetaModelParserAdapter;
import org.aascore.codegen.parse.tree.Comparison;
import org.aascore.codegen.parse.tree.Implication;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for building syntax-level definitions out of the host syntax tree.
 */
class ModelBuilderTest {

    private static DefinitionTable build(String source) {
        return new ModelBuilder(new LineIndex(source)).build(MetaModelParserAdapter.parse(source));
    }

    /**
     * @return The messages of the underlying diagnostics of the single failed definition
     */
    private static List<String> failureOf(String source) {
        var error = assertThrows(MetaModelCompileException.class, () -> build(source));
        assertEquals(1, error.getDiagnostics().size());
        return error.getDiagnostics().get(0).underlying().stream()
                .map(Diagnostic::message)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Well-formed meta-model")
    class WellFormed {

        private final DefinitionTable table = build(MetaModelFixtures.SAMPLE);

        @Test
        void definitionsInDeclarationOrder() {
            List<String> names = table.definitions().stream()
                    .map(definition -> definition.name().value())
                    .collect(Collectors.toList());

            assertEquals(List.of("Modality_kind", "Has_tags", "Qualifier", "Reference"), names);
        }

        @Test
        void enumerationWithLiteralDocstrings() {
            EnumerationDefinition modality = table.findEnumeration(Identifier.of("Modality_kind"));

            assertEquals("Enumerate the modalities.", modality.description().summary());
            assertEquals(2, modality.literals().size());
            assertEquals("MUST", modality.literals().get(0).value());
            assertEquals("The value is required.", modality.literals().get(0).description().summary());
            assertNull(modality.literals().get(1).description());
        }

        @Test
        void abstractClassWithInvariant() {
            ClassDefinition hasTags = table.findClass(Identifier.of("Has_tags"));

            assertTrue(hasTags.isAbstract());
            assertEquals(List.of(), hasTags.inheritances());
            assertEquals(1, hasTags.invariants().size());
            assertEquals("Tags must not be empty.", hasTags.invariants().get(0).description());
            assertInstanceOf(Implication.class, hasTags.invariants().get(0).condition());
        }

        @Test
        void serializationMarkers() {
            ClassDefinition qualifier = table.findClass(Identifier.of("Qualifier"));

            assertEquals(new JsonSerialization(true), qualifier.jsonSerialization());
            assertEquals(new XmlSerialization(Identifier.of("value")), qualifier.xmlSerialization());
            assertNull(table.findClass(Identifier.of("Reference")).jsonSerialization());
        }

        @Test
        void constructorArgumentsStartWithSelf() {
            MethodDefinition init = table.findClass(Identifier.of("Qualifier")).constructor();

            assertTrue(init.isConstructor());
            assertInstanceOf(TypeExpression.SelfType.class, init.arguments().get(0).type());
            assertEquals("references", init.arguments().get(2).name().value());
            assertEquals("List[Reference]", init.arguments().get(2).type().print());
            assertNotNull(init.arguments().get(3).defaultValue());
            assertEquals(1, init.contracts().preconditions().size());
            assertInstanceOf(Comparison.class, init.contracts().preconditions().get(0).condition());
        }

        @Test
        void finalPropertyIsReadOnly() {
            PropertyDefinition target = table.findClass(Identifier.of("Reference")).findProperty(Identifier.of("target"));

            assertTrue(target.readOnly());
            assertEquals("str", target.type().print());
        }

        @Test
        void implementationSpecificMethodWithPostcondition() {
            MethodDefinition resolve = table.findClass(Identifier.of("Reference")).findMethod(Identifier.of("resolve"));

            assertTrue(resolve.implementationSpecific());
            assertEquals("Optional[str]", resolve.returns().print());
            assertEquals(List.of(Identifier.of("result")), resolve.contracts().postconditions().get(0).args());
        }

        @Test
        void descriptionWithFieldsAndReferences() {
            Description description = table.findClass(Identifier.of("Qualifier")).description();

            assertEquals("Qualify something.", description.summary());
            assertEquals(List.of("Refers to :class:`.Has_tags`."), description.remarks());
            assertEquals(List.of(new Description.Field("param value", "the value")), description.fields());
            assertEquals(List.of(".Has_tags"), description.classReferences());
        }
    }

    @Nested
    @DisplayName("Methods and contracts")
    class Methods {

        @Test
        void contractsAreCollectedBottomUp() {
            DefinitionTable table = build("""
                    class A:
                        @require(lambda self, x: x > 0)
                        @require(lambda self, x: x < 10)
                        def f(self, x: int) -> None:
                            pass
                    """);

            var preconditions = table.findClass(Identifier.of("A")).findMethod(Identifier.of("f"))
                    .contracts().preconditions();
            assertEquals(2, preconditions.size());
            assertEquals("LT", ((Comparison) preconditions.get(0).condition()).op().name());
            assertEquals("GT", ((Comparison) preconditions.get(1).condition()).op().name());
        }

        @Test
        void snapshotNameDefaultsToItsArgument() {
            DefinitionTable table = build("""
                    class A:
                        @snapshot(lambda items: len(items))
                        @ensure(lambda OLD, items: len(items) >= OLD.items)
                        def f(self, items: List[int]) -> None:
                            pass
                    """);

            var contracts = table.findClass(Identifier.of("A")).findMethod(Identifier.of("f")).contracts();
            assertEquals("items", contracts.snapshots().get(0).name().value());
        }

        @Test
        void oldWithoutSnapshotIsRejected() {
            List<String> messages = failureOf("""
                    class A:
                        @ensure(lambda OLD: OLD.x > 0)
                        def f(self) -> None:
                            pass
                    """);

            assertEquals(List.of("Failed to parse the method: f"), messages);
        }

        @Test
        void missingReturnAnnotationIsRejected() {
            var error = assertThrows(MetaModelCompileException.class, () -> build("""
                    class A:
                        def f(self):
                            pass
                    """));

            Diagnostic method = error.getDiagnostics().get(0).underlying().get(0);
            assertEquals("Unexpected method without a type annotation for the result: f",
                    method.underlying().get(0).message());
        }

        @Test
        void dunderMethodsOtherThanInitAreRejected() {
            var error = assertThrows(MetaModelCompileException.class, () -> build("""
                    class A:
                        def __str__(self) -> str:
                            pass
                    """));

            Diagnostic method = error.getDiagnostics().get(0).underlying().get(0);
            assertEquals("Among all dunder methods, only ``__init__`` is expected, but got: __str__",
                    method.underlying().get(0).message());
        }

        @Test
        void initMustReturnNone() {
            var error = assertThrows(MetaModelCompileException.class, () -> build("""
                    class A:
                        def __init__(self) -> int:
                            pass
                    """));

            Diagnostic method = error.getDiagnostics().get(0).underlying().get(0);
            assertEquals("Expected __init__ to return None, but got: int", method.underlying().get(0).message());
        }
    }

    @Nested
    @DisplayName("Rejected definitions")
    class Rejected {

        @Test
        void reservedClassName() {
            assertEquals(List.of("The name of the class is reserved for aas-core: 'Verification'"),
                    failureOf("class Verification:\n    pass\n"));
        }

        @Test
        void enumerationWithAnotherBase() {
            assertEquals(
                    List.of("Expected an enumeration to only inherit from ``Enum``, but it inherits from: [Enum, DBC]"),
                    failureOf("class E(Enum, DBC):\n    A = \"a\"\n"));
        }

        @Test
        void nonStringLiteral() {
            assertEquals(List.of("Expected a string literal in the enumeration, but got: 1"),
                    failureOf("class E(Enum):\n    A = 1\n"));
        }

        @Test
        void abstractAndImplementationSpecific() {
            List<String> messages = failureOf("""
                    @abstract
                    @implementation_specific
                    class A:
                        pass
                    """);

            assertEquals(1, messages.size());
            assertTrue(messages.get(0).startsWith("Abstract classes can not be implementation-specific"));
        }

        @Test
        void repeatedJsonSerialization() {
            assertEquals(List.of("Repeated markings for JSON serialization are not allowed"), failureOf("""
                    @json_serialization(with_model_type=True)
                    @json_serialization(with_model_type=False)
                    class A:
                        pass
                    """));
        }

        @Test
        void propertyWithValue() {
            var error = assertThrows(MetaModelCompileException.class, () -> build("class A:\n    x: int = 1\n"));

            Diagnostic property = error.getDiagnostics().get(0).underlying().get(0);
            assertEquals("Failed to parse a property", property.message());
            assertEquals("Unexpected assignment of a value to a property", property.underlying().get(0).message());
        }

        @Test
        void everyFailedMemberOfAClassIsReported() {
            assertEquals(List.of("Failed to parse a property", "Failed to parse a property",
                    "Failed to parse the method: f"), failureOf("""
                    class A:
                        x: int = 1
                        y: int = 2

                        def f(self):
                            pass
                    """));
        }

        @Test
        void errorsOfSeveralDefinitionsAreCollected() {
            var error = assertThrows(MetaModelCompileException.class, () -> build("""
                    class A(Enum):
                        X = 1

                    class B:
                        x: int = 0
                    """));

            assertEquals(List.of(
                    "Failed to parse the class definition: A",
                    "Failed to parse the class definition: B"), error.getDiagnostics().stream()
                    .map(Diagnostic::message)
                    .collect(Collectors.toList()));
        }
    }

    @Nested
    @DisplayName("Verification of the table")
    class Verification {

        @Test
        void duplicateSymbol() {
            var error = assertThrows(MetaModelCompileException.class,
                    () -> build("class A:\n    pass\n\nclass A:\n    pass\n"));

            assertEquals("The symbol with the name A has been already defined", error.getMessage());
        }

        @Test
        void danglingInheritance() {
            var error = assertThrows(MetaModelCompileException.class, () -> build("class A(Missing):\n    pass\n"));

            assertEquals("The inheritance for class A is dangling: Missing", error.getMessage());
        }

        @Test
        void inheritanceFromEnumeration() {
            var error = assertThrows(MetaModelCompileException.class,
                    () -> build("class E(Enum):\n    X = \"x\"\n\nclass A(E):\n    pass\n"));

            assertEquals("Expected the class A to inherit from a class, but it inherits from an enumeration: E",
                    error.getMessage());
        }

        @Test
        void inheritanceFromConcreteClassIsAllowed() {
            DefinitionTable table = build("class A:\n    pass\n\nclass B(A):\n    pass\n");

            assertEquals(List.of(Identifier.of("A")), table.findClass(Identifier.of("B")).inheritances());
        }
    }
}
