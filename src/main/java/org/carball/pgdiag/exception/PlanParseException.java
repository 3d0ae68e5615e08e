package org.carball.pgdiag.exception;

import lombok.Getter;

/**
 * Raised when an EXPLAIN payload cannot be turned into a plan tree.
 */
@Getter
public class PlanParseException extends DiagnosticsException {

    /** 1-based line number of the offending line, or 0 when not line oriented. */
    private final int lineNumber;

    public PlanParseException(String message) {
        this(message, 0);
    }

    public PlanParseException(String message, int lineNumber) {
        super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message);
        this.lineNumber = lineNumber;
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = 0;
    }
}
