package org.aascore.codegen;

import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.intermediate.IntermediateDumper;
import org.aascore.codegen.intermediate.SymbolTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the compiler facade.
 */
class MetaModelCompilerTest {

    private final MetaModelCompiler compiler = new MetaModelCompiler();

    @Nested
    @DisplayName("Successful compilation")
    class Successful {

        @Test
        void compilesTheSample() {
            SymbolTable table = compiler.compile(MetaModelFixtures.SAMPLE);

            assertEquals(4, table.symbols().size());
            assertEquals(3, table.classes().size());
        }

        @Test
        void compilationIsDeterministic() {
            String first = IntermediateDumper.dump(compiler.compile(MetaModelFixtures.SAMPLE));
            String second = IntermediateDumper.dump(compiler.compile(MetaModelFixtures.SAMPLE));

            assertEquals(first, second);
        }

        @Test
        void dumpShowsTheFlattenedModel() {
            String dump = IntermediateDumper.dump(compiler.compile(MetaModelFixtures.SAMPLE));

            assertTrue(dump.contains("Enumeration Modality_kind\n"), dump);
            assertTrue(dump.contains("  literal Must = \"MUST\"\n"), dump);
            assertTrue(dump.contains("AbstractClass Has_tags\n"), dump);
            assertTrue(dump.contains("ConcreteClass Qualifier\n"), dump);
            assertTrue(dump.contains("  property tags: Optional[List[str]] from Has_tags\n"), dump);
            assertTrue(dump.contains("  property references: List[Reference] from Qualifier\n"), dump);
            assertTrue(dump.contains("    self.kind = kind or Modality_kind.Must\n"), dump);
            assertTrue(dump.contains("  property target: str (read-only) from Reference\n"), dump);
            assertTrue(dump.contains("  json serialization: with_model_type=true\n"), dump);
            assertTrue(dump.contains("  xml serialization: property_as_text=value\n"), dump);
        }

        @Test
        void emptyMetaModel() {
            SymbolTable table = compiler.compile(MetaModelFixtures.IMPORTS);

            assertTrue(table.symbols().isEmpty());
        }
    }

    @Nested
    @DisplayName("Failed compilation")
    class Failed {

        @Test
        void syntaxErrorBecomesDiagnostic() {
            String source = "class A(:\n    pass\n";
            var error = assertThrows(MetaModelCompileException.class, () -> compiler.compile(source));

            assertEquals(1, error.getDiagnostics().size());
            String rendered = compiler.render(source, error);
            assertTrue(rendered.startsWith("At line 1 and column "), rendered);
            assertTrue(rendered.contains("Failed to parse the meta-model: "), rendered);
        }

        @Test
        void importErrorStopsCompilation() {
            String source = "from os import path\n";
            var error = assertThrows(MetaModelCompileException.class, () -> compiler.compile(source));

            assertTrue(error.getMessage().contains("path"), error.getMessage());
        }

        @Test
        void inheritanceCycleHidesConstructorErrors() {
            String source = """
                    class A(B):
                        def __init__(self) -> None:
                            x = 1

                    class B(A):
                        pass
                    """;
            var error = assertThrows(MetaModelCompileException.class, () -> compiler.compile(source));

            assertEquals(1, error.getDiagnostics().size());
            assertEquals("Expected no cycles in the inheritance, but the class A has been observed in a cycle",
                    error.getMessage());
        }

        @Test
        void nestedDiagnosticsAreIndented() {
            String source = """
                    class A(Enum):
                        X = 1
                    """;
            var error = assertThrows(MetaModelCompileException.class, () -> compiler.compile(source));

            assertEquals("""
                    At line 1 and column 1: Failed to parse the class definition: A
                      At line 2 and column 9: Expected a string literal in the enumeration, but got: 1
                    """, compiler.render(source, error));
        }

        @Test
        void renderingIsDeterministic() {
            String source = """
                    class A:
                        x: Missing

                    class B:
                        y: Absent
                    """;
            var first = assertThrows(MetaModelCompileException.class, () -> compiler.compile(source));
            var second = assertThrows(MetaModelCompileException.class, () -> compiler.compile(source));

            assertEquals(compiler.render(source, first), compiler.render(source, second));
            assertEquals(2, compiler.render(source, first).lines().count());
        }
    }
}
