package org.aascore.codegen.common;

/**
 * Exception thrown when the meta-model source is not valid in the host grammar.
 * Includes optional source location information.
 */
public class MetaModelParseException extends RuntimeException {

    private final String detail;
    private final int line;
    private final int column;
    private final int offset;

    public MetaModelParseException(String message) {
        super(message);
        this.detail = message;
        this.line = -1;
        this.column = -1;
        this.offset = -1;
    }

    public MetaModelParseException(String message, int line, int column, int offset) {
        super("line " + line + ":" + column + " " + message);
        this.detail = message;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    /**
     * @return The message without the location prefix
     */
    public String getDetail() {
        return detail;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return Code point offset of the offending token, or -1 if unknown
     */
    public int getOffset() {
        return offset;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
