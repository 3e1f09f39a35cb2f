package org.aascore.codegen.parse;

import org.aascore.codegen.common.MetaModelCompileException;
import org.aascore.codegen.common.SourceSpan;
import org.aascore.codegen.parse.syntax.Expr;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DescriptionParserTest {

    private static Description parse(String text) {
        return DescriptionParser.parse(new Expr.Constant(text, new SourceSpan(0, text.length())));
    }

    @Test
    void singleLineSummary() {
        Description description = parse("Represent a key.");

        assertEquals("Represent a key.", description.summary());
        assertEquals(List.of(), description.remarks());
        assertEquals(List.of(), description.fields());
    }

    @Test
    void indentedDocstringIsDedented() {
        Description description = parse("""
                    Summary line
                    continues here.

                    First remark.

                    Second remark
                      with indentation.
                """);

        assertEquals("Summary line\ncontinues here.", description.summary());
        assertEquals(List.of("First remark.", "Second remark\n  with indentation."), description.remarks());
    }

    @Test
    void fieldListWithContinuation() {
        Description description = parse("""
                    Set the value.

                    :param value: the value to set,
                      never empty
                    :returns: nothing
                """);

        assertEquals(List.of(
                new Description.Field("param value", "the value to set,\nnever empty"),
                new Description.Field("returns", "nothing")), description.fields());
    }

    @Test
    void referencesAreCollected() {
        Description description = parse(
                "See :class:`.Submodel` and :py:attr:`id_short` of :class:`.Referable`.");

        assertEquals(List.of(".Submodel", ".Referable"), description.classReferences());
        assertEquals(List.of("id_short"), description.attributeReferences());
    }

    @Test
    void emptyDescriptionIsRejected() {
        var error = assertThrows(MetaModelCompileException.class, () -> parse("   \n   "));
        assertEquals("Unexpected empty description", error.getMessage());
    }

    @Test
    void fieldListBeforeSummaryIsRejected() {
        var error = assertThrows(MetaModelCompileException.class, () -> parse(":param x: something"));
        assertEquals("Expected a summary paragraph before the field list in the description", error.getMessage());
    }

    @Test
    void cleanDropsSurroundingBlankLines() {
        assertEquals(List.of("a", "", "b"), DescriptionParser.clean("\n    a\n\n    b\n    "));
    }
}
