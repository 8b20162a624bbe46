package com.phillippitts.driftwatch.service.orchestration;

/**
 * Lifecycle of the drift monitor.
 *
 * <pre>
 * IDLE → WAITING (file absent) → ACTIVE → DRAINING → STOPPED
 * IDLE → ACTIVE (file present)
 * ACTIVE → WAITING (file vanished)
 * </pre>
 */
public enum MonitorState {
    IDLE,
    WAITING,
    ACTIVE,
    DRAINING,
    STOPPED;

    boolean canTransitionTo(MonitorState target) {
        return switch (this) {
            case IDLE -> target == WAITING || target == ACTIVE || target == DRAINING;
            case WAITING -> target == ACTIVE || target == DRAINING;
            case ACTIVE -> target == WAITING || target == DRAINING;
            case DRAINING -> target == STOPPED;
            case STOPPED -> false;
        };
    }
}
