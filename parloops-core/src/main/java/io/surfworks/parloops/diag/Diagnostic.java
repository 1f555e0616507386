package io.surfworks.parloops.diag;

import java.util.Objects;

import io.surfworks.parloops.ir.Location;

/**
 * A message attached to an operation.
 *
 * @param severity how serious the message is
 * @param location source position of the operation
 * @param opName name of the operation the message is about, or null for function-level messages
 * @param message human-readable text
 */
public record Diagnostic(Severity severity, Location location, String opName, String message) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        location = location != null ? location : Location.UNKNOWN;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Formats as {@code file:line:col: error: 'lhlo.reduce_window' op message}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(location).append(": ").append(severity.label()).append(": ");
        if (opName != null) {
            sb.append('\'').append(opName).append("' op ");
        }
        sb.append(message);
        return sb.toString();
    }
}
