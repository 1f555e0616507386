package io.surfworks.parloops.exec;

import java.util.List;

import io.surfworks.parloops.ir.Operation;

/**
 * Execution logic for one region-free operation.
 *
 * <p>Runtime values are {@link Buffer} for memrefs, {@code Long} for index and
 * integer values, {@code Double} for floating-point values and {@code Boolean}
 * for {@code i1}.
 */
@FunctionalInterface
public interface OpKernel {

    /**
     * Execute the operation.
     *
     * @param op the operation to execute
     * @param operands runtime values of its operands
     * @return runtime values of its results
     */
    List<Object> execute(Operation op, List<Object> operands);
}
