package com.phillippitts.driftwatch.exception;

import java.nio.file.Path;

/**
 * Thrown when the tailed log file cannot be read (permissions, device errors).
 *
 * <p>Transient by nature: the monitor reports it and retries on the next poll.
 */
public class LogSourceException extends DriftWatchException {

    private final Path path;

    public LogSourceException(Path path, String message, Throwable cause) {
        super("Failed to read " + path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
