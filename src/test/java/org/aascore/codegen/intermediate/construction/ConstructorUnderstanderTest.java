package org.aascore.codegen.intermediate.construction;

import org.aascore.codegen.MetaModelFixtures;
import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.DefinitionTable;
import org.aascore.codegen.parse.ModelBuilder;
import org.aascore.codegen.parse.antlr.MetaModelParserAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConstructorUnderstanderTest {

    private static ConstructorUnderstander understanderOf(String source) {
        LineIndex index = new LineIndex(source);
        DefinitionTable table = new ModelBuilder(index).build(MetaModelParserAdapter.parse(source));
        return new ConstructorUnderstander(table, index);
    }

    private static List<ConstructorStatement> understand(String source, String className) {
        return understanderOf(source).understandAll().mustFind(Identifier.of(className));
    }

    /**
     * @return Messages of the diagnostics below "Failed to understand the constructor ..."
     */
    private static List<String> failureOf(String source) {
        var error = assertThrows(MetaModelCompileException.class, () -> understanderOf(source).understandAll());
        assertEquals(1, error.getDiagnostics().size());
        return error.getDiagnostics().get(0).underlying().stream()
                .map(Diagnostic::message)
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Understood statements")
    class Understood {

        @Test
        void superCallAndAssignmentsWithDefaults() {
            List<ConstructorStatement> statements = understand(MetaModelFixtures.SAMPLE, "Qualifier");

            assertEquals(4, statements.size());
            var superCall = (ConstructorStatement.CallSuperConstructor) statements.get(0);
            assertEquals("Has_tags", superCall.superName().value());

            var value = (ConstructorStatement.AssignArgument) statements.get(1);
            assertEquals("value", value.name().value());
            assertEquals("value", value.argument().value());
            assertNull(value.defaultValue());

            var kind = (ConstructorStatement.AssignArgument) statements.get(3);
            var literal = (ConstructorDefault.EnumLiteral) kind.defaultValue();
            assertEquals("Modality_kind", literal.enumeration().value());
            assertEquals("Must", literal.literal().value());
        }

        @Test
        void emptyListDefault() {
            List<ConstructorStatement> statements = understand("""
                    class A:
                        items: List[int]

                        def __init__(self, items: Optional[List[int]] = None) -> None:
                            self.items = items if items is not None else []
                    """, "A");

            var assign = (ConstructorStatement.AssignArgument) statements.get(0);
            assertInstanceOf(ConstructorDefault.EmptyList.class, assign.defaultValue());
        }

        @Test
        void keywordArgumentsToSuperAndPass() {
            List<ConstructorStatement> statements = understand("""
                    class A:
                        x: int

                        def __init__(self, x: int) -> None:
                            self.x = x

                    class B(A):
                        def __init__(self, x: int) -> None:
                            A.__init__(self, x=x)
                            pass
                    """, "B");

            assertEquals(1, statements.size());
            assertInstanceOf(ConstructorStatement.CallSuperConstructor.class, statements.get(0));
        }

        @Test
        void classWithoutConstructorHasNoStatements() {
            assertEquals(List.of(), understand("class A:\n    pass\n", "A"));
        }
    }

    @Nested
    @DisplayName("Rejected statements")
    class Rejected {

        @Test
        void callToNonParent() {
            assertEquals(List.of(
                    "Expected a super class in the call to a super ``__init__``, but B does not inherit from C"),
                    failureOf("""
                            class C:
                                def __init__(self) -> None:
                                    pass

                            class B:
                                def __init__(self) -> None:
                                    C.__init__(self)
                            """));
        }

        @Test
        void renamedForwarding() {
            List<String> messages = failureOf("""
                    class A:
                        x: int

                        def __init__(self, x: int) -> None:
                            self.x = x

                    class B(A):
                        def __init__(self, y: int) -> None:
                            A.__init__(self, x=y)
                    """);

            assertEquals(List.of("Failed to parse the arguments to the super ``__init__``"), messages);
        }

        @Test
        void missingSuperArgument() {
            var error = assertThrows(MetaModelCompileException.class, () -> understanderOf("""
                    class A:
                        x: int
                        y: int

                        def __init__(self, x: int, y: int) -> None:
                            self.x = x
                            self.y = y

                    class B(A):
                        def __init__(self, x: int, y: int) -> None:
                            A.__init__(self, x)
                    """).understandAll());

            Diagnostic arguments = error.getDiagnostics().get(0).underlying().get(0);
            assertEquals("The call to ``A.__init__`` is missing one or more arguments: y",
                    arguments.underlying().get(0).message());
        }

        @Test
        void assignmentOfUnknownProperty() {
            assertEquals(List.of("The property has not been previously defined in A: y"), failureOf("""
                    class A:
                        x: int

                        def __init__(self, x: int) -> None:
                            self.y = x
                    """));
        }

        @Test
        void assignmentOfDifferentArgument() {
            assertEquals(List.of("Expected the property x to be assigned exactly the argument with the same name, "
                    + "but got: other"), failureOf("""
                    class A:
                        x: int

                        def __init__(self, x: int, other: int) -> None:
                            self.x = other
                    """));
        }

        @Test
        void unsupportedDefault() {
            assertEquals(List.of("The handling of this default value for the property x has not been implemented"),
                    failureOf("""
                            class A:
                                x: int

                                def __init__(self, x: Optional[int] = None) -> None:
                                    self.x = x if x is not None else 3
                            """));
        }

        @Test
        void unexpectedStatement() {
            List<String> messages = failureOf("""
                    class A:
                        def __init__(self) -> None:
                            return
                    """);

            assertEquals(1, messages.size());
            assertTrue(messages.get(0).startsWith("Unexpected statement in the body of ``__init__``: return"));
        }

        @Test
        void errorsOfAllStatementsAreCollected() {
            assertEquals(2, failureOf("""
                    class A:
                        x: int

                        def __init__(self, x: int) -> None:
                            self.y = x
                            self.z = x
                    """).size());
        }
    }
}
