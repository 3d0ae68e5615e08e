package org.carball.pgdiag.exception;

/**
 * Base type for every failure the diagnostics engine reports to its caller.
 * None of these are fatal to the host process; the facade turns them into failed report sections.
 */
public class DiagnosticsException extends RuntimeException {

    public DiagnosticsException(String message) {
        super(message);
    }

    public DiagnosticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
