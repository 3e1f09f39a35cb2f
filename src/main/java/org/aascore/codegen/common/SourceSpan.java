package org.aascore.codegen.common;

/**
 * A half-open range of code points in the source text.
 *
 * @param start Offset of the first code point
 * @param end   Offset after the last code point
 */
public record SourceSpan(int start, int end) {

    public SourceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid source span: [" + start + ", " + end + ")");
        }
    }

    public SourceSpan union(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(end, other.end));
    }
}
