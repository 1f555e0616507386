package io.surfworks.parloops.ir;

/**
 * Scoped save/restore of an {@link OpBuilder} insertion point.
 *
 * <pre>{@code
 * try (InsertionGuard guard = builder.guard()) {
 *     builder.setInsertionPointToStart(region.front());
 *     ...
 * }
 * }</pre>
 */
public final class InsertionGuard implements AutoCloseable {

    private final OpBuilder builder;
    private final Block savedBlock;
    private final Operation savedBefore;
    private boolean closed;

    InsertionGuard(OpBuilder builder, Block savedBlock, Operation savedBefore) {
        this.builder = builder;
        this.savedBlock = savedBlock;
        this.savedBefore = savedBefore;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        builder.restoreInsertionPoint(savedBlock, savedBefore);
    }
}
