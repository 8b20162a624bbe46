package com.phillippitts.driftwatch.service.ingest;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published when log ingestion hits a recoverable fault. None of these stop the monitor.
 *
 * @param reason what happened
 * @param path the monitored file
 * @param detail short technical detail (may be empty)
 * @param at when it happened
 */
public record IngestionFaultEvent(Reason reason, Path path, String detail, Instant at) {

    public enum Reason {
        /** File does not exist (yet); re-checked on every poll. */
        WAITING_FOR_FILE,
        /** File shrank below the cursor; reading restarts at byte 0. */
        TRUNCATED,
        /** File was replaced by a different file; reading restarts at byte 0. */
        ROTATED,
        /** File disappeared after being read; waiting for it to reappear. */
        VANISHED,
        /** Read failed; retried on the next poll. */
        IO_ERROR,
        /** A line exceeded the line limit and was dropped. */
        LINE_TOO_LONG
    }

    public IngestionFaultEvent {
        if (at == null) {
            at = Instant.now();
        }
        if (detail == null) {
            detail = "";
        }
    }
}
