package io.surfworks.parloops.pass;

import io.surfworks.parloops.config.LoweringOptions;

/**
 * Creates a configured pass instance.
 */
@FunctionalInterface
public interface PassFactory {
    FunctionPass create(LoweringOptions options);
}
