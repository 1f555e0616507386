package io.surfworks.parloops.rewrite;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of conversion patterns keyed by root operation name.
 *
 * <p>Patterns registered for the same operation are tried in registration order.
 *
 * <pre>{@code
 * RewritePatternSet patterns = new RewritePatternSet()
 *     .add(new ReduceOpConverter())
 *     .add(new ReduceWindowOpConverter(options));
 * }</pre>
 */
public final class RewritePatternSet {

    private final Map<String, List<ConversionPattern>> byRoot = new LinkedHashMap<>();

    public RewritePatternSet() {}

    /**
     * Adds a pattern.
     *
     * @param pattern the pattern to add
     * @return this set for chaining
     */
    public RewritePatternSet add(ConversionPattern pattern) {
        byRoot.computeIfAbsent(pattern.rootOpName(), k -> new ArrayList<>()).add(pattern);
        return this;
    }

    public List<ConversionPattern> patternsFor(String opName) {
        return List.copyOf(byRoot.getOrDefault(opName, List.of()));
    }

    public List<ConversionPattern> patterns() {
        List<ConversionPattern> all = new ArrayList<>();
        byRoot.values().forEach(all::addAll);
        return all;
    }

    public int size() {
        return byRoot.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return byRoot.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("RewritePatternSet[patterns=%d, roots=%s]", size(), byRoot.keySet());
    }
}
