package io.surfworks.parloops.config;

/**
 * What to do when a windowed reduction has no {@code window_strides} or no {@code padding}.
 */
public enum AttributePolicy {
    /** Report an error and lower with stride 1 / padding 0. */
    LENIENT,
    /** Report an error and leave the operation unconverted. */
    STRICT
}
