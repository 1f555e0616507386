package io.surfworks.parloops.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.surfworks.parloops.diag.DiagnosticEngine;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;

/**
 * Builder handed to {@link ConversionPattern}s.
 *
 * <p>Operations created through the rewriter during an attempt are recorded.
 * Erasures and use replacements are deferred until the attempt is committed,
 * so an attempt that ends in {@link RewriteStatus#NO_MATCH} leaves the
 * function exactly as it was.
 */
public final class PatternRewriter extends OpBuilder {

    private final Function function;
    private final DiagnosticEngine diagnostics;
    private final List<Operation> created = new ArrayList<>();
    private final List<Operation> pendingErase = new ArrayList<>();
    private final List<Value[]> pendingReplace = new ArrayList<>();

    public PatternRewriter(Function function, DiagnosticEngine diagnostics) {
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
    }

    public Function function() {
        return function;
    }

    public DiagnosticEngine diagnostics() {
        return diagnostics;
    }

    /**
     * Schedules {@code op} for removal when the attempt is committed.
     */
    public void eraseOp(Operation op) {
        pendingErase.add(op);
    }

    /**
     * Replaces every use of {@code op}'s results with {@code replacements}
     * and erases {@code op} when the attempt is committed.
     */
    public void replaceOp(Operation op, List<Value> replacements) {
        if (replacements.size() != op.numResults()) {
            throw new IllegalArgumentException(String.format("%s has %d results, got %d replacements",
                    op.name(), op.numResults(), replacements.size()));
        }
        for (int i = 0; i < replacements.size(); i++) {
            pendingReplace.add(new Value[] {op.result(i), replacements.get(i)});
        }
        eraseOp(op);
    }

    @Override
    protected void notifyOperationInserted(Operation op) {
        created.add(op);
    }

    /**
     * Number of operations created in the current attempt.
     */
    public int createdCount() {
        return created.size();
    }

    void beginAttempt(Operation root) {
        created.clear();
        pendingErase.clear();
        pendingReplace.clear();
        setInsertionPoint(root);
    }

    void commit() {
        for (Value[] pair : pendingReplace) {
            function.replaceAllUsesWith(pair[0], pair[1]);
        }
        for (Operation op : pendingErase) {
            if (op.parentBlock() != null) {
                op.erase();
            }
        }
        created.clear();
        pendingErase.clear();
        pendingReplace.clear();
    }

    void rollback() {
        for (int i = created.size() - 1; i >= 0; i--) {
            Operation op = created.get(i);
            if (op.parentBlock() != null) {
                op.erase();
            }
        }
        created.clear();
        pendingErase.clear();
        pendingReplace.clear();
    }
}
