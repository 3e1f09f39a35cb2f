package org.aascore.codegen.parse;

import org.aascore.codegen.common.SourceSpan;

import java.util.List;
import java.util.Objects;

/**
 * A docstring split into its parts. Downstream generators render the parts;
 * below the translator the text is treated as opaque.
 *
 * @param summary             The first paragraph
 * @param remarks             The following paragraphs, in order
 * @param fields              The entries of the field list ({@code :name: body})
 * @param classReferences     Targets of {@code :class:} roles, as written
 * @param attributeReferences Targets of {@code :py:attr:} roles, as written
 * @param span                The docstring literal
 */
public record Description(
        String summary,
        List<String> remarks,
        List<Field> fields,
        List<String> classReferences,
        List<String> attributeReferences,
        SourceSpan span) {

    public Description {
        Objects.requireNonNull(summary, "Description summary cannot be null");
        remarks = List.copyOf(remarks);
        fields = List.copyOf(fields);
        classReferences = List.copyOf(classReferences);
        attributeReferences = List.copyOf(attributeReferences);
    }

    /**
     * One entry of a field list, e.g. {@code :param x: the value}.
     */
    public record Field(String name, String body) {
    }
}
