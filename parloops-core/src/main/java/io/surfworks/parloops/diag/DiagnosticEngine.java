package io.surfworks.parloops.diag;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.Operation;

/**
 * Collects diagnostics emitted while transforming IR.
 *
 * <p>Every diagnostic is also mirrored to the log at the level of its
 * {@link Severity}. The engine is not thread-safe; use one per pipeline run.
 */
public final class DiagnosticEngine {

    private static final Logger LOG = Logger.getLogger(DiagnosticEngine.class.getName());

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public DiagnosticEngine() {}

    public Diagnostic emitError(Operation op, String message) {
        return emit(Severity.ERROR, op, message);
    }

    public Diagnostic emitWarning(Operation op, String message) {
        return emit(Severity.WARNING, op, message);
    }

    public Diagnostic emitRemark(Operation op, String message) {
        return emit(Severity.REMARK, op, message);
    }

    public Diagnostic emit(Severity severity, Operation op, String message) {
        return report(new Diagnostic(severity, op.location(), op.name(), message));
    }

    /**
     * Emits a diagnostic that is not tied to an operation.
     */
    public Diagnostic emit(Severity severity, Location location, String message) {
        return report(new Diagnostic(severity, location, null, message));
    }

    public Diagnostic report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        LOG.log(diagnostic.severity().logLevel(), diagnostic.toString());
        return diagnostic;
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics(Severity severity) {
        return diagnostics.stream()
                .filter(d -> d.severity() == severity)
                .toList();
    }

    public int count(Severity severity) {
        return (int) diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    public void clear() {
        diagnostics.clear();
    }

    @Override
    public String toString() {
        return String.format("DiagnosticEngine[errors=%d, warnings=%d, remarks=%d]",
                count(Severity.ERROR), count(Severity.WARNING), count(Severity.REMARK));
    }
}
