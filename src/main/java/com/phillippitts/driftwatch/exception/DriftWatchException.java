package com.phillippitts.driftwatch.exception;

/**
 * Base exception for all driftwatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DriftWatchException extends RuntimeException {

    public DriftWatchException(String message) {
        super(message);
    }

    public DriftWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public DriftWatchException(Throwable cause) {
        super(cause);
    }
}
