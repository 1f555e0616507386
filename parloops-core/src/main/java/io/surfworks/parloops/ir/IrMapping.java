package io.surfworks.parloops.ir;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value substitution table used when cloning IR.
 *
 * <p>A mapping is meant to live for a single clone scope. Reusing one across
 * unrelated clones leaks substitutions between them.
 */
public final class IrMapping {

    private final Map<Value, Value> values = new IdentityHashMap<>();

    public IrMapping() {}

    public IrMapping map(Value from, Value to) {
        values.put(from, to);
        return this;
    }

    /**
     * Maps {@code from.get(i)} to {@code to.get(i)} pairwise.
     */
    public IrMapping map(List<Value> from, List<Value> to) {
        if (from.size() != to.size()) {
            throw new IllegalArgumentException(
                    "Mapping size mismatch: " + from.size() + " values to " + to.size());
        }
        for (int i = 0; i < from.size(); i++) {
            values.put(from.get(i), to.get(i));
        }
        return this;
    }

    public boolean contains(Value from) {
        return values.containsKey(from);
    }

    /**
     * @throws IllegalArgumentException if {@code from} is not mapped
     */
    public Value lookup(Value from) {
        Value to = values.get(from);
        if (to == null) {
            throw new IllegalArgumentException("No mapping for " + from);
        }
        return to;
    }

    public Value lookupOrDefault(Value from) {
        return values.getOrDefault(from, from);
    }

    public int size() {
        return values.size();
    }
}
