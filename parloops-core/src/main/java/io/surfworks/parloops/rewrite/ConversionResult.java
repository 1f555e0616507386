package io.surfworks.parloops.rewrite;

import java.util.List;

import io.surfworks.parloops.ir.Operation;

/**
 * Result of a partial conversion over one function.
 *
 * @param succeeded true if no illegal operation remains
 * @param convertedCount number of successful pattern applications
 * @param remainingIllegal illegal operations left in the function
 */
public record ConversionResult(boolean succeeded, int convertedCount, List<Operation> remainingIllegal) {

    public ConversionResult {
        remainingIllegal = List.copyOf(remainingIllegal);
    }

    @Override
    public String toString() {
        return String.format("ConversionResult[%s, converted=%d, remaining=%d]",
                succeeded ? "success" : "failure", convertedCount, remainingIllegal.size());
    }
}
