package com.phillippitts.driftwatch.domain;

import java.util.List;

/**
 * A completed tumbling window. Only ever constructed full; partial windows stay inside
 * {@code WindowAggregator} and are visible solely as progress counts.
 *
 * @param id zero-based, gap-free window sequence number
 * @param observations the window's observations in arrival order
 * @param mean mean of the observation values
 * @param stddev population standard deviation of the observation values
 */
public record Window(long id, List<Observation> observations, double mean, double stddev) {

    public Window {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got: " + id);
        }
        if (observations == null || observations.isEmpty()) {
            throw new IllegalArgumentException("observations must not be empty");
        }
        observations = List.copyOf(observations);
    }

    public int size() {
        return observations.size();
    }

    /** Timestamp of the newest observation, used as the alert timestamp. */
    public String lastTimestamp() {
        return observations.get(observations.size() - 1).timestamp();
    }
}
