package com.phillippitts.driftwatch.service.detect;

/**
 * Streaming change-point detector fed one value at a time over the whole stream,
 * independent of tumbling-window boundaries.
 */
public interface ChangeDetector {

    /**
     * Adds a value to the detector.
     *
     * @param value next value of the stream
     * @return {@code true} if this value caused a change to be flagged
     */
    boolean observe(double value);

    /** Whether the most recent {@link #observe} call flagged a change. */
    boolean isChangeDetected();

    /** Number of values currently retained by the detector's adaptive window. */
    long width();
}
