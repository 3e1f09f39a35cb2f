package org.aascore.codegen.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps code point offsets of one source text to 1-based line and column
 * numbers, and renders diagnostics against that text.
 */
public final class LineIndex {

    private final int[] codePoints;
    private final int[] lineStarts;

    public LineIndex(String source) {
        this.codePoints = source.codePoints().toArray();

        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < codePoints.length; i++) {
            int cp = codePoints[i];
            if (cp == '\n') {
                starts.add(i + 1);
            } else if (cp == '\r') {
                if (i + 1 < codePoints.length && codePoints[i + 1] == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * A 1-based line and column.
     */
    public record Position(int line, int column) {
    }

    public Position position(int offset) {
        int clamped = Math.max(0, Math.min(offset, codePoints.length));
        int found = Arrays.binarySearch(lineStarts, clamped);
        int lineIndex = found >= 0 ? found : -found - 2;
        return new Position(lineIndex + 1, clamped - lineStarts[lineIndex] + 1);
    }

    public Position position(SourceSpan span) {
        return position(span.start());
    }

    /**
     * Inverse of {@link #position(int)}; out-of-range lines clamp to the text.
     */
    public int offset(Position position) {
        int lineIndex = Math.max(0, Math.min(position.line() - 1, lineStarts.length - 1));
        return Math.min(lineStarts[lineIndex] + Math.max(0, position.column() - 1), codePoints.length);
    }

    /**
     * @return The source text covered by the span
     */
    public String text(SourceSpan span) {
        int start = Math.min(span.start(), codePoints.length);
        int end = Math.min(span.end(), codePoints.length);
        return new String(codePoints, start, end - start);
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Renders a diagnostic and its underlying diagnostics, each nesting level
     * indented by two more spaces.
     */
    public String render(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        render(diagnostic, 0, sb);
        return sb.toString();
    }

    public String render(List<Diagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic diagnostic : diagnostics) {
            render(diagnostic, 0, sb);
        }
        return sb.toString();
    }

    private void render(Diagnostic diagnostic, int depth, StringBuilder sb) {
        String indent = "  ".repeat(depth);
        sb.append(indent);
        if (diagnostic.hasSpan()) {
            Position position = position(diagnostic.span());
            sb.append("At line ").append(position.line())
                    .append(" and column ").append(position.column()).append(": ");
        }
        sb.append(diagnostic.message().replace("\n", "\n" + indent)).append('\n');
        for (Diagnostic underlying : diagnostic.underlying()) {
            render(underlying, depth + 1, sb);
        }
    }
}
