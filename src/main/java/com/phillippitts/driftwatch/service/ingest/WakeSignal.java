package com.phillippitts.driftwatch.service.ingest;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded-wait primitive shared by the wake-up producers and the monitor control loop.
 *
 * <p>Producers (the file watcher, the shutdown path) only enqueue; the control loop is the only
 * consumer. File-change wake-ups are lossy: when the queue is full they are dropped, which is safe
 * because the poll timeout re-reads the file anyway. Cancellation is additionally latched in a
 * volatile flag so it can never be lost.
 */
public final class WakeSignal {

    public enum Reason { FILE_CHANGED, POLL_TIMEOUT, CANCEL }

    static final int QUEUE_CAPACITY = 64;

    private final BlockingQueue<Reason> queue = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private volatile boolean cancelled = false;

    /** Signals that the file may have new data. Never blocks. */
    public void fileChanged() {
        queue.offer(Reason.FILE_CHANGED);
    }

    /** Requests the control loop to stop. Idempotent. */
    public void cancel() {
        cancelled = true;
        queue.offer(Reason.CANCEL);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Waits for the next wake-up. Pending file-change signals are coalesced into one.
     *
     * @param timeout poll interval; shorter than 1ms is treated as 1ms
     * @return the wake-up reason; {@link Reason#POLL_TIMEOUT} when nothing arrived in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Reason await(Duration timeout) throws InterruptedException {
        if (cancelled) {
            return Reason.CANCEL;
        }
        // At least 1ms so the loop never spins.
        long waitMillis = Math.max(1L, timeout.toMillis());
        Reason reason = queue.poll(waitMillis, TimeUnit.MILLISECONDS);
        queue.clear();
        if (cancelled) {
            return Reason.CANCEL;
        }
        return reason == null ? Reason.POLL_TIMEOUT : reason;
    }
}
