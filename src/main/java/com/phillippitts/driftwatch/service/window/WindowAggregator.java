package com.phillippitts.driftwatch.service.window;

import com.phillippitts.driftwatch.domain.Observation;
import com.phillippitts.driftwatch.domain.Window;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-capacity, non-overlapping (tumbling) window over observations.
 *
 * <p>Mean and variance are maintained incrementally with Welford's algorithm, so completing a
 * window costs O(1) regardless of its capacity. When the count reaches capacity the completed
 * {@link Window} is returned and a fresh window with the next id begins. Windows are never
 * emitted partially filled; {@link #progress()} is the only view of the open window.
 *
 * <p>Not thread-safe: confined to the monitor control thread.
 */
public final class WindowAggregator {

    private final int capacity;

    private long windowId = 0;
    private List<Observation> buffer;
    private double mean = 0.0;
    private double m2 = 0.0;

    public WindowAggregator(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayList<>(capacity);
    }

    /**
     * Appends an observation to the open window.
     *
     * @param observation observation to add
     * @return the completed window if this observation filled it, otherwise empty
     */
    public Optional<Window> observe(Observation observation) {
        Objects.requireNonNull(observation, "observation must not be null");
        buffer.add(observation);
        int n = buffer.size();
        double delta = observation.value() - mean;
        mean += delta / n;
        m2 += delta * (observation.value() - mean);

        if (n < capacity) {
            return Optional.empty();
        }

        double stddev = Math.sqrt(Math.max(0.0, m2 / n));
        Window completed = new Window(windowId, buffer, mean, stddev);
        windowId++;
        buffer = new ArrayList<>(capacity);
        mean = 0.0;
        m2 = 0.0;
        return Optional.of(completed);
    }

    public int capacity() {
        return capacity;
    }

    /** Observations buffered in the open window. */
    public int pending() {
        return buffer.size();
    }

    /** Id the open window will carry when it completes. */
    public long currentWindowId() {
        return windowId;
    }

    /** Fill of the open window, e.g. {@code "40/100"}. */
    public String progress() {
        return buffer.size() + "/" + capacity;
    }
}
