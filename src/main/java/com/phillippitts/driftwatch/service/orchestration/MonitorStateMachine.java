package com.phillippitts.driftwatch.service.orchestration;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe holder of the monitor lifecycle state.
 *
 * <p>Only the control thread changes state; health checks and shutdown read it from other
 * threads, hence the explicit lock. Illegal transitions are rejected, and
 * {@link MonitorState#STOPPED} is terminal.
 *
 * @since 1.0
 */
public final class MonitorStateMachine {

    private final Lock lock = new ReentrantLock();
    private MonitorState state = MonitorState.IDLE;

    /**
     * Attempts a transition.
     *
     * @param target desired state
     * @return {@code true} if the state changed, {@code false} if already in {@code target}
     *         or the transition is not allowed
     * @throws NullPointerException if target is null
     */
    public boolean transitionTo(MonitorState target) {
        Objects.requireNonNull(target, "target cannot be null");
        lock.lock();
        try {
            if (!state.canTransitionTo(target)) {
                return false;
            }
            state = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public MonitorState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isStopped() {
        return current() == MonitorState.STOPPED;
    }
}
