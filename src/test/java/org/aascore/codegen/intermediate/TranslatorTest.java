package org.aascore.codegen.intermediate;

import org.aascore.codegen.MetaModelCompiler;
import org.aascore.codegen.MetaModelFixtures;
import org.aascore.codegen.common.Diagnostic;
import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.intermediate.construction.ConstructorDefault;
import org.aascore.codegen.parse.JsonSerialization;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the translation into the final symbol table, run through the whole pipeline.
 */
class TranslatorTest {

    private static SymbolTable compile(String source) {
        return new MetaModelCompiler().compile(source);
    }

    private static List<String> errorsOf(String source) {
        var error = assertThrows(MetaModelCompileException.class, () -> compile(source));
        return error.getDiagnostics().stream().map(Diagnostic::message).collect(Collectors.toList());
    }

    private static List<String> names(List<? extends Symbol> symbols) {
        return symbols.stream().map(symbol -> symbol.name().value()).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Symbol table of the sample meta-model")
    class Sample {

        private final SymbolTable table = compile(MetaModelFixtures.SAMPLE);
        private final ModelClass qualifier = table.mustFindClass(Identifier.of("Qualifier"));

        @Test
        void symbolsInDeclarationOrder() {
            assertEquals(List.of("Modality_kind", "Has_tags", "Qualifier", "Reference"), names(table.symbols()));
            assertEquals(List.of("Modality_kind"), names(table.enumerations()));
            assertEquals(List.of("Qualifier", "Reference"), names(table.concreteClasses()));
            assertEquals(List.of("Has_tags"), names(table.abstractClasses()));
        }

        @Test
        void forwardReferenceIsResolved() {
            var references = (TypeAnnotation.ListType) qualifier.findProperty(Identifier.of("references"))
                    .orElseThrow().type();
            var items = (TypeAnnotation.OurType) references.items();

            assertSame(table.mustFindClass(Identifier.of("Reference")), items.symbol());
        }

        @Test
        void inheritedPropertiesComeFirst() {
            List<String> properties = qualifier.properties().stream()
                    .map(property -> property.name() + "@" + property.specifiedFor())
                    .collect(Collectors.toList());

            assertEquals(List.of(
                    "tags@Has_tags", "value@Qualifier", "kind@Qualifier", "references@Qualifier"), properties);
        }

        @Test
        void propertyTypes() {
            assertEquals("Optional[List[str]]", qualifier.properties().get(0).type().print());
            var kind = (TypeAnnotation.OurType) qualifier.findProperty(Identifier.of("kind")).orElseThrow().type();
            assertSame(table.mustFindEnumeration(Identifier.of("Modality_kind")), kind.symbol());

            Property target = table.mustFindClass(Identifier.of("Reference")).properties().get(0);
            assertTrue(target.readOnly());
            assertEquals(new TypeAnnotation.Primitive(PrimitiveType.STR), target.type());
        }

        @Test
        void invariantsAreStacked() {
            assertEquals(1, qualifier.invariants().size());
            assertEquals(Identifier.of("Has_tags"), qualifier.invariants().get(0).specifiedFor());
        }

        @Test
        void hierarchyReferences() {
            assertEquals(List.of("Has_tags"), names(qualifier.parentClasses()));
            assertEquals(List.of("Has_tags"), names(qualifier.antecedentClasses()));

            ModelClass hasTags = table.mustFindClass(Identifier.of("Has_tags"));
            assertEquals(List.of("Qualifier"), names(hasTags.concreteDescendantClasses()));
            assertTrue(hasTags.isAbstract());
        }

        @Test
        void constructorIsFlattened() {
            Constructor constructor = qualifier.constructor();

            assertEquals(List.of("value", "references", "tags", "kind"), constructor.arguments().stream()
                    .map(argument -> argument.name().value())
                    .collect(Collectors.toList()));
            assertEquals(new Default.DefaultConstant(null), constructor.arguments().get(2).defaultValue());
            assertEquals(4, constructor.statements().size());
            assertInstanceOf(ConstructorDefault.EnumLiteral.class, constructor.statements().get(3).defaultValue());
            assertEquals(1, constructor.contracts().preconditions().size());
            assertFalse(constructor.implementationSpecific());
        }

        @Test
        void methodsCarryImplementationKeys() {
            ModelClass reference = table.mustFindClass(Identifier.of("Reference"));
            Method resolve = reference.findMethod(Identifier.of("resolve")).orElseThrow();

            assertEquals("Reference.resolve", resolve.implementationKey());
            assertTrue(resolve.implementationSpecific());
            assertEquals(new TypeAnnotation.OptionalType(new TypeAnnotation.Primitive(PrimitiveType.STR)),
                    resolve.returns());
            assertEquals(1, resolve.arguments().size());
            assertEquals(new Default.DefaultConstant(BigInteger.ONE), resolve.arguments().get(0).defaultValue());
            assertEquals("Reference", reference.implementationKey());
            assertEquals("Reference.__init__", reference.constructorImplementationKey());
        }

        @Test
        void serializationSettings() {
            assertTrue(qualifier.jsonSerialization().withModelType());
            assertEquals(Identifier.of("value"), qualifier.xmlSerialization().propertyAsText());
            assertEquals(new JsonSerialization(false),
                    table.mustFindClass(Identifier.of("Reference")).jsonSerialization());
        }

        @Test
        void lookups() {
            assertTrue(table.find(Identifier.of("Unknown")).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> table.mustFind(Identifier.of("Unknown")));
            assertThrows(IllegalArgumentException.class,
                    () -> table.mustFindEnumeration(Identifier.of("Qualifier")));
            assertThrows(IllegalArgumentException.class,
                    () -> table.mustFindClass(Identifier.of("Modality_kind")));

            Enumeration modality = table.mustFindEnumeration(Identifier.of("Modality_kind"));
            assertEquals("SHOULD", modality.findLiteral(Identifier.of("Should")).orElseThrow().value());
        }
    }

    @Nested
    @DisplayName("Constructors and defaults")
    class Constructors {

        @Test
        void contractsOfAntecedentConstructorsAreStacked() {
            SymbolTable table = compile("""
                    class A:
                        x: int

                        @require(lambda x: x > 0)
                        def __init__(self, x: int) -> None:
                            self.x = x

                    class B(A):
                        y: int

                        @require(lambda y: y > 0)
                        def __init__(self, x: int, y: int) -> None:
                            A.__init__(self, x)
                            self.y = y
                    """);

            List<Contract> preconditions = table.mustFindClass(Identifier.of("B")).constructor()
                    .contracts().preconditions();
            assertEquals(List.of(List.of(Identifier.of("x")), List.of(Identifier.of("y"))), preconditions.stream()
                    .map(Contract::args)
                    .collect(Collectors.toList()));
        }

        @Test
        void implementationSpecificConstructor() {
            SymbolTable table = compile("""
                    class A:
                        @implementation_specific
                        def __init__(self) -> None:
                            pass
                    """);

            assertTrue(table.mustFindClass(Identifier.of("A")).constructor().implementationSpecific());
        }

        @Test
        void enumerationLiteralAndNegativeDefaults() {
            SymbolTable table = compile("""
                    class Kind(Enum):
                        One = "one"

                    class A:
                        def f(self, kind: Kind = Kind.One, offset: int = -1) -> None:
                            pass
                    """);

            List<Argument> arguments = table.mustFindClass(Identifier.of("A"))
                    .findMethod(Identifier.of("f")).orElseThrow().arguments();
            var literal = (Default.DefaultEnumerationLiteral) arguments.get(0).defaultValue();
            assertSame(table.mustFindEnumeration(Identifier.of("Kind")), literal.enumeration().symbol());
            assertEquals(Identifier.of("One"), literal.literal());
            assertEquals(new Default.DefaultConstant(BigInteger.valueOf(-1)), arguments.get(1).defaultValue());
        }

        @Test
        void unsupportedDefault() {
            assertEquals(List.of("The default value of the argument items is not supported: []"), errorsOf("""
                    class A:
                        def f(self, items: List[int] = []) -> None:
                            pass
                    """));
        }

        @Test
        void uninitializedProperty() {
            assertEquals(List.of("The property x of the class A is not initialized in the constructor"), errorsOf("""
                    class A:
                        x: int
                    """));
        }

        @Test
        void mandatoryPropertyFromOptionalArgument() {
            assertEquals(List.of("The property x of the class A is not properly initialized in the constructor: "
                    + "it is mandatory, but the argument x is optional and no default value is given"), errorsOf("""
                    class A:
                        x: int

                        def __init__(self, x: Optional[int] = None) -> None:
                            self.x = x
                    """));
        }

        @Test
        void mandatoryPropertyFromOptionalArgumentWithDefault() {
            SymbolTable table = compile("""
                    class A:
                        items: List[int]

                        def __init__(self, items: Optional[List[int]] = None) -> None:
                            self.items = items if items is not None else []
                    """);

            assertEquals(1, table.mustFindClass(Identifier.of("A")).constructor().statements().size());
        }

        @Test
        void diamondWithConstructors() {
            SymbolTable table = compile("""
                    class A:
                        a: int

                        def __init__(self, a: int) -> None:
                            self.a = a

                    class B(A):
                        b: int

                        def __init__(self, a: int, b: int) -> None:
                            A.__init__(self, a)
                            self.b = b

                    class C(A):
                        c: int

                        def __init__(self, a: int, c: int) -> None:
                            A.__init__(self, a)
                            self.c = c

                    class D(B, C):
                        def __init__(self, a: int, b: int, c: int) -> None:
                            B.__init__(self, a, b)
                            C.__init__(self, a, c)
                    """);

            ModelClass d = table.mustFindClass(Identifier.of("D"));
            assertEquals(List.of("a", "b", "c"), d.properties().stream()
                    .map(property -> property.name().value())
                    .collect(Collectors.toList()));
            assertEquals(3, d.constructor().statements().size());
        }

        @Test
        void noInitializerUnderReceiverOnlyAntecedent() {
            SymbolTable table = compile("""
                    class A:
                        def __init__(self) -> None:
                            pass

                    class B(A):
                        pass
                    """);

            ModelClass b = table.mustFindClass(Identifier.of("B"));
            assertEquals(List.of(), b.properties());
            assertEquals(List.of(), b.constructor().statements());
        }
    }

    @Nested
    @DisplayName("Type annotations")
    class TypeAnnotations {

        @Test
        void laterDeclaredClassResolves() {
            SymbolTable table = compile("""
                    class A:
                        b: B

                        def __init__(self, b: B) -> None:
                            self.b = b

                    class B:
                        pass
                    """);

            var type = (TypeAnnotation.OurType) table.mustFindClass(Identifier.of("A")).properties().get(0).type();
            assertSame(table.mustFind(Identifier.of("B")), type.symbol());
        }

        @Test
        void danglingReference() {
            assertEquals(List.of("The type annotation could not be found in the symbol table: Missing"), errorsOf("""
                    class A:
                        x: Missing
                    """));
        }

        @Test
        void arityMismatch() {
            assertEquals(List.of("Expected exactly 1 type argument(s) for Optional, but got 2: Optional[int, str]"),
                    errorsOf("""
                            class A:
                                x: Optional[int, str]
                            """));
            assertEquals(List.of("Expected exactly 2 type argument(s) for Mapping, but got 1: Mapping[str]"),
                    errorsOf("""
                            class A:
                                x: Mapping[str]
                            """));
        }

        @Test
        void mappingIsNotSupported() {
            assertEquals(List.of("The type annotation Mapping is not supported in the intermediate representation: "
                    + "Mapping[str, int]"), errorsOf("""
                    class A:
                        x: Mapping[str, int]
                    """));
        }

        @Test
        void bareGeneric() {
            assertEquals(List.of("Expected the type annotation List to be subscripted, but it is used bare"),
                    errorsOf("""
                            class A:
                                x: List
                            """));
        }

        @Test
        void sequenceBecomesList() {
            SymbolTable table = compile("""
                    class A:
                        def f(self, xs: Sequence[int]) -> None:
                            pass
                    """);

            Argument xs = table.mustFindClass(Identifier.of("A")).methods().get(0).arguments().get(0);
            assertEquals(new TypeAnnotation.ListType(new TypeAnnotation.Primitive(PrimitiveType.INT)), xs.type());
        }

        @Test
        void errorsAccumulateAcrossClasses() {
            assertEquals(List.of(
                    "The type annotation could not be found in the symbol table: Missing",
                    "The type annotation could not be found in the symbol table: Absent"), errorsOf("""
                    class A:
                        x: Missing

                    class B:
                        y: Absent
                    """));
        }
    }

    @Nested
    @DisplayName("JSON serialization settings")
    class JsonSerializationSettings {

        @Test
        void modelTypeIsInherited() {
            SymbolTable table = compile("""
                    @abstract
                    @json_serialization(with_model_type=True)
                    class A:
                        pass

                    class B(A):
                        pass

                    class C(B):
                        pass
                    """);

            assertTrue(table.mustFindClass(Identifier.of("B")).jsonSerialization().withModelType());
            assertTrue(table.mustFindClass(Identifier.of("C")).jsonSerialization().withModelType());
        }

        @Test
        void modelTypeDefaultsToFalse() {
            SymbolTable table = compile("""
                    class A:
                        pass

                    class B(A):
                        pass
                    """);

            assertFalse(table.mustFindClass(Identifier.of("B")).jsonSerialization().withModelType());
        }

        @Test
        void conflictingSettingIsRejected() {
            assertEquals(List.of("The serialization setting ``with_model_type`` between the class A and B "
                    + "is inconsistent"), errorsOf("""
                    @json_serialization(with_model_type=True)
                    class A:
                        pass

                    @json_serialization(with_model_type=False)
                    class B(A):
                        pass
                    """));
        }

        @Test
        void propertyTypeWithConcreteDescendantsNeedsModelType() {
            assertEquals(List.of(
                    "The class A has one or more concrete descendants (B), but its serialization setting "
                            + "``with_model_type`` has not been set; "
                            + "the model type is needed to discriminate at de-serialization",
                    "The class B needs the serialization setting ``with_model_type`` since it is "
                            + "a concrete descendant of the class A, which is used as a property type"), errorsOf("""
                    @abstract
                    class A:
                        pass

                    class B(A):
                        pass

                    class Holder:
                        content: A

                        def __init__(self, content: A) -> None:
                            self.content = content
                    """));
        }

        @Test
        void propertyTypeWithInheritedModelTypeIsAccepted() {
            SymbolTable table = compile("""
                    @abstract
                    @json_serialization(with_model_type=True)
                    class A:
                        pass

                    class B(A):
                        pass

                    class Holder:
                        contents: Optional[List[A]]

                        def __init__(self, contents: Optional[List[A]] = None) -> None:
                            self.contents = contents
                    """);

            assertEquals(List.of("B"), names(table.mustFindClass(Identifier.of("A")).concreteDescendantClasses()));
        }
    }

    @Nested
    @DisplayName("Reserved names")
    class ReservedNames {

        @Test
        void reservedSymbolName() {
            assertEquals(List.of("The name of the symbol Visitor is reserved for the generated code; please rename it"),
                    errorsOf("""
                            class Visitor:
                                pass
                            """));
        }

        @Test
        void reservedPropertyName() {
            assertEquals(List.of("The member name model_type of the class A is reserved for the generated code; "
                    + "please rename it"), errorsOf("""
                    class A:
                        model_type: str
                    """));
        }

        @Test
        void reservedMethodName() {
            assertEquals(List.of("The member name accept of the class A is reserved for the generated code; "
                    + "please rename it"), errorsOf("""
                    class A:
                        def accept(self) -> None:
                            pass
                    """));
        }
    }

    @Nested
    @DisplayName("Enumerations and descriptions")
    class EnumerationsAndDescriptions {

        @Test
        void supersetContainsAllLiterals() {
            SymbolTable table = compile("""
                    class Sub(Enum):
                        A = "a"

                    @is_superset_of(enums=[Sub])
                    class Super(Enum):
                        A = "a"
                        B = "b"
                    """);

            Enumeration superset = table.mustFindEnumeration(Identifier.of("Super"));
            assertSame(table.mustFindEnumeration(Identifier.of("Sub")), superset.isSupersetOf().get(0).symbol());
        }

        @Test
        void supersetMissingLiteral() {
            assertEquals(List.of("The literal A with the value \"a\" of the enumeration Sub is missing in its superset Super"),
                    errorsOf("""
                            class Sub(Enum):
                                A = "a"

                            @is_superset_of(enums=[Sub])
                            class Super(Enum):
                                B = "b"
                            """));
        }

        @Test
        void supersetOfClass() {
            assertEquals(List.of("The enumeration Super is marked as a superset of Cls, but Cls is not an enumeration"),
                    errorsOf("""
                            class Cls:
                                pass

                            @is_superset_of(enums=[Cls])
                            class Super(Enum):
                                B = "b"
                            """));
        }

        @Test
        void classReferenceWithoutDot() {
            assertEquals(List.of("Expected the class reference to start with a dot, but got: Cls"), errorsOf("""
                    class Cls:
                        \"""See :class:`Cls`.\"""
                    """));
        }

        @Test
        void classReferenceToUnknownSymbol() {
            assertEquals(List.of("The class reference could not be found in the symbol table: Missing"), errorsOf("""
                    class Cls:
                        \"""See :class:`.Missing`.\"""
                    """));
        }
    }
}
