package io.surfworks.parloops.ir;

/**
 * Source position of an operation, used to anchor diagnostics.
 *
 * @param source file name or a synthetic name such as {@code <builder>}
 * @param line 1-based line, or -1 when unknown
 * @param column 1-based column, or -1 when unknown
 */
public record Location(String source, int line, int column) {

    public static final Location UNKNOWN = new Location("<unknown>", -1, -1);

    public static Location of(String source, int line, int column) {
        return new Location(source, line, column);
    }

    public static Location named(String source) {
        return new Location(source, -1, -1);
    }

    public boolean isKnown() {
        return line >= 0;
    }

    @Override
    public String toString() {
        if (line < 0) {
            return source;
        }
        return source + ":" + line + ":" + column;
    }
}
