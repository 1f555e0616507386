package io.surfworks.parloops.text;

/**
 * Exception thrown while tokenizing or parsing textual IR.
 */
public class IrParseException extends RuntimeException {

    private final int line;
    private final int column;

    public IrParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public IrParseException(String message, int line, int column) {
        super(String.format("%s at line %d, column %d", message, line, column));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
