package io.surfworks.parloops.config;

/**
 * What to do with {@code base_dilations} / {@code window_dilations} on a windowed reduction.
 */
public enum DilationPolicy {
    /** Emit a remark; the generated loops do not dilate. */
    IGNORE_WITH_REMARK,
    /** Emit an error and leave the operation unconverted. */
    REJECT
}
