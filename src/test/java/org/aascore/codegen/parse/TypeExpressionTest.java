package org.aascore.codegen.parse;

import org.aascore.codegen.common.Identifier;
import org.aascore.codegen.common.LineIndex;
import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.parse.antlr.MetaModelParserAdapter;
import org.aascore.codegen.parse.syntax.Stmt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeExpressionTest {

    private static TypeExpression parse(String annotation) {
        String source = "x: " + annotation + "\n";
        var annAssign = (Stmt.AnnAssign) MetaModelParserAdapter.parse(source).body().get(0);
        return new TypeExpressionParser(new LineIndex(source)).parse(annAssign.annotation());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "str",
            "Reference",
            "List[Key]",
            "Optional[List[Reference]]",
            "Mapping[str, int]",
            "Final[Optional[str]]"})
    void printedAnnotationParsesBackToEqualValue(String annotation) {
        TypeExpression parsed = parse(annotation);

        assertEquals(annotation, parsed.print());
        assertEquals(parsed, parse(parsed.print()));
    }

    @Test
    void stringAnnotationIsAtomic() {
        assertEquals(new TypeExpression.Atomic(Identifier.of("Reference")), parse("\"Reference\""));
    }

    @Test
    void subscriptsOfTupleAreKeptInOrder() {
        var subscripted = (TypeExpression.Subscripted) parse("Mapping[str, List[int]]");

        assertEquals("Mapping", subscripted.identifier().value());
        assertEquals(List.of(
                new TypeExpression.Atomic(Identifier.of("str")),
                new TypeExpression.Subscripted(Identifier.of("List"),
                        List.of(new TypeExpression.Atomic(Identifier.of("int"))))), subscripted.subscripts());
    }

    @Test
    void bareFinalIsRejected() {
        var error = assertThrows(MetaModelCompileException.class, () -> parse("Final"));
        assertEquals("The type annotation ``Final`` needs to be subscripted with exactly one type", error.getMessage());
    }

    @Test
    void attributeAnnotationIsRejected() {
        var error = assertThrows(MetaModelCompileException.class, () -> parse("typing.List"));
        assertEquals("Unexpected type annotation: typing.List", error.getMessage());
    }

    @Test
    void selfTypePrints() {
        assertEquals("SELF", new TypeExpression.SelfType().print());
    }
}
