package io.surfworks.parloops.rewrite;

import io.surfworks.parloops.ir.Operation;

/**
 * Converts operations of one kind into operations the conversion target accepts.
 *
 * <p>Implementations must be stateless: the same instance is applied to every
 * matching operation of every function.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public final class CopyToLoops implements ConversionPattern {
 *     public String rootOpName() { return LhloOps.COPY; }
 *
 *     public RewriteStatus matchAndRewrite(Operation op, PatternRewriter rewriter) {
 *         ...
 *         rewriter.eraseOp(op);
 *         return RewriteStatus.REWRITTEN;
 *     }
 * }
 * }</pre>
 */
public interface ConversionPattern {

    /**
     * Returns the name of the operations this pattern is tried on.
     */
    String rootOpName();

    /**
     * Returns a short name for logging.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Attempts the conversion. The rewriter's insertion point is set in front
     * of {@code op} on entry.
     *
     * <p>Returning {@link RewriteStatus#NO_MATCH} is not an error: the
     * rewriter rolls back anything created during the attempt and leaves
     * {@code op} untouched. Diagnostics emitted before returning are kept.
     */
    RewriteStatus matchAndRewrite(Operation op, PatternRewriter rewriter);
}
