package io.surfworks.parloops.ir;

import java.util.List;
import java.util.Optional;

/**
 * A named collection of functions.
 */
public record Module(String name, List<Function> functions) {

    public Module {
        functions = List.copyOf(functions);
    }

    public Optional<Function> getFunction(String functionName) {
        return functions.stream()
                .filter(f -> f.name().equals(functionName))
                .findFirst();
    }
}
