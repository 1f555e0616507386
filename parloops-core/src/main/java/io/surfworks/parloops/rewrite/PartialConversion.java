package io.surfworks.parloops.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.parloops.diag.DiagnosticEngine;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.Operation;

/**
 * Applies conversion patterns to the illegal operations of a function.
 *
 * <p>The driver sweeps the function in pre-order and tries every pattern
 * registered for each illegal operation. Sweeps repeat while they make
 * progress, so illegal operations produced by a rewrite are converted too.
 * An operation whose patterns all fail is not retried. Operations the target
 * does not know are left alone.
 *
 * <p>Example usage:
 * <pre>{@code
 * ConversionResult result = PartialConversion.apply(function, target, patterns, diagnostics);
 * if (!result.succeeded()) {
 *     // result.remainingIllegal() lists what is left
 * }
 * }</pre>
 */
public final class PartialConversion {

    private static final Logger LOG = Logger.getLogger(PartialConversion.class.getName());

    private PartialConversion() {}

    public static ConversionResult apply(
            Function function,
            ConversionTarget target,
            RewritePatternSet patterns,
            DiagnosticEngine diagnostics) {
        PatternRewriter rewriter = new PatternRewriter(function, diagnostics);
        Set<Operation> failed = Collections.newSetFromMap(new IdentityHashMap<>());
        int converted = 0;

        boolean progress = true;
        while (progress) {
            progress = false;
            for (Operation op : function.allOperations()) {
                if (failed.contains(op) || !target.isIllegal(op) || !isAttached(op, function)) {
                    continue;
                }
                if (tryConvert(op, patterns, rewriter)) {
                    converted++;
                    progress = true;
                } else {
                    failed.add(op);
                }
            }
        }

        List<Operation> remaining = new ArrayList<>();
        for (Operation op : function.allOperations()) {
            if (target.isIllegal(op)) {
                remaining.add(op);
            }
        }
        ConversionResult result = new ConversionResult(remaining.isEmpty(), converted, remaining);
        LOG.fine(() -> String.format("@%s: %s", function.name(), result));
        return result;
    }

    private static boolean tryConvert(Operation op, RewritePatternSet patterns, PatternRewriter rewriter) {
        for (ConversionPattern pattern : patterns.patternsFor(op.name())) {
            rewriter.beginAttempt(op);
            RewriteStatus status = pattern.matchAndRewrite(op, rewriter);
            if (status.succeeded()) {
                LOG.fine(() -> String.format("%s rewrote %s at %s (%d new ops)",
                        pattern.name(), op.name(), op.location(), rewriter.createdCount()));
                rewriter.commit();
                return true;
            }
            LOG.fine(() -> String.format("%s did not match %s at %s", pattern.name(), op.name(), op.location()));
            rewriter.rollback();
        }
        return false;
    }

    /**
     * Returns true if {@code op} is still reachable from the function body.
     * Operations nested in an erased operation keep their parent block, so
     * the whole ancestor chain is checked.
     */
    private static boolean isAttached(Operation op, Function function) {
        Block block = op.parentBlock();
        while (block != null) {
            Operation owner = block.parentOp();
            if (owner == null) {
                return block == function.body();
            }
            block = owner.parentBlock();
        }
        return false;
    }
}
