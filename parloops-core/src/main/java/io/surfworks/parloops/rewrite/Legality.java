package io.surfworks.parloops.rewrite;

/**
 * Classification of an operation by a {@link ConversionTarget}.
 */
public enum Legality {
    /** Allowed to remain after conversion. */
    LEGAL,
    /** Must be converted; its presence afterwards fails the conversion. */
    ILLEGAL,
    /** Not mentioned by the target; left alone by a partial conversion. */
    UNKNOWN
}
