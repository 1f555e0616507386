package io.surfworks.parloops.pass;

import java.util.Objects;

import io.surfworks.parloops.diag.DiagnosticEngine;

/**
 * State shared by the passes of one pipeline run.
 */
public final class PassContext {

    private final DiagnosticEngine diagnostics;

    public PassContext() {
        this(new DiagnosticEngine());
    }

    public PassContext(DiagnosticEngine diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
    }

    public DiagnosticEngine diagnostics() {
        return diagnostics;
    }
}
