package com.phillippitts.driftwatch.service.health;

import com.phillippitts.driftwatch.domain.RunSummary;
import com.phillippitts.driftwatch.service.orchestration.MonitorOrchestrator;
import com.phillippitts.driftwatch.service.orchestration.MonitorPipeline;
import com.phillippitts.driftwatch.service.orchestration.MonitorState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the drift monitor.
 *
 * <ul>
 *   <li>UP: tailing the log file</li>
 *   <li>WAITING: log file does not exist yet</li>
 *   <li>OUT_OF_SERVICE: draining or stopped</li>
 *   <li>UNKNOWN: not started</li>
 * </ul>
 */
@Component
public class MonitorHealthIndicator implements HealthIndicator {

    static final Status WAITING = new Status("WAITING", "Log file not present yet");

    private final MonitorOrchestrator orchestrator;
    private final MonitorPipeline pipeline;

    public MonitorHealthIndicator(MonitorOrchestrator orchestrator, MonitorPipeline pipeline) {
        this.orchestrator = orchestrator;
        this.pipeline = pipeline;
    }

    @Override
    public Health health() {
        MonitorState state = orchestrator.state();
        Health.Builder builder = switch (state) {
            case ACTIVE -> Health.up();
            case WAITING -> Health.status(WAITING);
            case DRAINING, STOPPED -> Health.outOfService();
            case IDLE -> Health.unknown();
        };
        RunSummary summary = pipeline.summary();
        return builder
                .withDetail("state", state.name())
                .withDetail("observations", summary.totalObservations())
                .withDetail("windows", summary.totalWindows())
                .withDetail("driftWindows", summary.driftWindows())
                .withDetail("currentWindow", pipeline.windowProgress())
                .build();
    }
}
