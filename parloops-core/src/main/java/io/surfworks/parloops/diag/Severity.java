package io.surfworks.parloops.diag;

import java.util.logging.Level;

/**
 * Diagnostic severity, ordered from least to most severe.
 */
public enum Severity {
    REMARK(Level.INFO),
    WARNING(Level.WARNING),
    ERROR(Level.SEVERE);

    private final Level logLevel;

    Severity(Level logLevel) {
        this.logLevel = logLevel;
    }

    /**
     * The java.util.logging level a diagnostic of this severity is mirrored at.
     */
    public Level logLevel() {
        return logLevel;
    }

    public String label() {
        return name().toLowerCase();
    }
}
