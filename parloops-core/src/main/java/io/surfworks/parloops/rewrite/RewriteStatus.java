package io.surfworks.parloops.rewrite;

/**
 * Outcome of a single conversion attempt.
 */
public enum RewriteStatus {
    /** The operation was replaced; the attempt's changes are kept. */
    REWRITTEN,
    /** The pattern does not apply; every operation it created is discarded. */
    NO_MATCH;

    public boolean succeeded() {
        return this == REWRITTEN;
    }
}
