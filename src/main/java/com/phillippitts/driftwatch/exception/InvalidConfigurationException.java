package com.phillippitts.driftwatch.exception;

/**
 * Thrown at startup when the monitor configuration is unusable (non-positive window size,
 * delta outside (0, 1), no log file to watch). Always fatal: the control loop is never started.
 */
public class InvalidConfigurationException extends DriftWatchException {

    private final String property;
    private final String reason;

    public InvalidConfigurationException(String property, String reason) {
        super("Invalid configuration " + property + ": " + reason);
        this.property = property;
        this.reason = reason;
    }

    public String getProperty() {
        return property;
    }

    public String getReason() {
        return reason;
    }
}
