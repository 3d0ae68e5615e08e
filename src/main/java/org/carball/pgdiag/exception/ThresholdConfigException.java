package org.carball.pgdiag.exception;

/**
 * Invalid threshold configuration. Raised before any analysis runs.
 */
public class ThresholdConfigException extends DiagnosticsException {

    public ThresholdConfigException(String message) {
        super(message);
    }
}
