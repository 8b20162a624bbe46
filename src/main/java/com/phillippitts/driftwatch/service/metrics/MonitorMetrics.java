package com.phillippitts.driftwatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer instrumentation for the drift monitor.
 *
 * <p>Provides counters for:
 * <ul>
 *   <li>Decoded observations and skipped (malformed) lines</li>
 *   <li>Completed windows, and drift windows per firing signal (adwin, baseline)</li>
 *   <li>Ingestion faults per reason (waiting, truncated, rotated, io_error, vanished, line_too_long)</li>
 * </ul>
 */
@Component
public class MonitorMetrics {

    private static final String METRIC_PREFIX = "driftwatch";

    private final MeterRegistry registry;
    private final Counter observations;
    private final Counter skippedLines;
    private final Counter windows;

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.observations = Counter.builder(METRIC_PREFIX + ".observations")
                .description("Observations decoded from the log")
                .register(registry);
        this.skippedLines = Counter.builder(METRIC_PREFIX + ".lines.skipped")
                .description("Lines rejected by the decoder")
                .register(registry);
        this.windows = Counter.builder(METRIC_PREFIX + ".windows")
                .description("Completed tumbling windows")
                .register(registry);
    }

    public void incrementObservations() {
        observations.increment();
    }

    public void incrementSkippedLines() {
        skippedLines.increment();
    }

    public void incrementWindows() {
        windows.increment();
    }

    /**
     * Counts a drifting window once per signal that fired.
     *
     * @param signal {@code adwin} or {@code baseline}
     */
    public void incrementDriftWindows(String signal) {
        Counter.builder(METRIC_PREFIX + ".windows.drift")
                .description("Windows flagged as drifting")
                .tag("signal", signal)
                .register(registry)
                .increment();
    }

    /**
     * Counts an ingestion fault.
     *
     * @param reason fault reason, lower case
     */
    public void incrementIngestFault(String reason) {
        Counter.builder(METRIC_PREFIX + ".ingest.faults")
                .description("Recovered log ingestion faults")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
