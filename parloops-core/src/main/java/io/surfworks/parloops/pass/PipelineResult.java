package io.surfworks.parloops.pass;

import java.util.List;

/**
 * Aggregate outcome of a {@link PassManager} run.
 */
public record PipelineResult(List<PassResult> results) {

    public PipelineResult {
        results = List.copyOf(results);
    }

    public boolean succeeded() {
        return results.stream().allMatch(PassResult::succeeded);
    }

    public List<PassResult> failures() {
        return results.stream().filter(r -> !r.succeeded()).toList();
    }

    public int totalRewrites() {
        return results.stream().mapToInt(PassResult::rewrites).sum();
    }

    @Override
    public String toString() {
        return String.format("PipelineResult[runs=%d, failures=%d, rewrites=%d]",
                results.size(), failures().size(), totalRewrites());
    }
}
