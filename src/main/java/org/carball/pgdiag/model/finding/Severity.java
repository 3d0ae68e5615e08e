package org.carball.pgdiag.model.finding;

/**
 * Finding severity, ordered from least to most severe.
 */
public enum Severity {
    INFO,
    NOTICE,
    WARNING,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
