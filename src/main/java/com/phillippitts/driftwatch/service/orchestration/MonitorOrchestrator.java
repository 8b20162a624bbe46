package com.phillippitts.driftwatch.service.orchestration;

import java.time.Duration;

/**
 * Owns the monitor control loop and its lifecycle.
 *
 * <p>Implementations run decoding, windowing and detection on a single control thread and
 * guarantee that the final {@code RunSummary} is published exactly once, however the loop ends.
 *
 * @since 1.0
 */
public interface MonitorOrchestrator {

    /**
     * Starts the control loop. Calling it more than once has no further effect.
     */
    void start();

    /**
     * Requests a graceful stop: the loop finishes the batch it is processing, leaves any partial
     * window incomplete, publishes the summary and terminates. Never blocks.
     */
    void requestStop();

    /**
     * Waits for the control loop to terminate.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the loop has terminated
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    MonitorState state();
}
