package io.surfworks.parloops.pass;

import io.surfworks.parloops.ir.Function;

/**
 * A transformation applied to one function at a time.
 *
 * <p>A pass mutates the function in place. Failure is reported through the
 * returned {@link PassResult}, never by throwing.
 */
public interface FunctionPass {

    /**
     * Returns the command-line name of this pass, e.g. {@code lhlo-legalize-to-parallel-loops}.
     */
    String name();

    /**
     * Returns a one-line description.
     */
    String description();

    PassResult run(Function function, PassContext context);
}
