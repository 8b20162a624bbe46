package com.phillippitts.driftwatch.domain;

import java.util.Objects;

/**
 * A single scalar observation decoded from one log line.
 *
 * @param timestamp RFC3339 timestamp as written by the producer (or stamped at ingestion)
 * @param value the observed model output
 */
public record Observation(String timestamp, double value) {

    public Observation {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite, got: " + value);
        }
    }
}
