package com.phillippitts.driftwatch.service.alert;

import com.phillippitts.driftwatch.domain.Alert;
import com.phillippitts.driftwatch.domain.BaselineResult;
import com.phillippitts.driftwatch.domain.RunSummary;
import com.phillippitts.driftwatch.domain.StatusSnapshot;
import com.phillippitts.driftwatch.domain.Window;
import com.phillippitts.driftwatch.service.metrics.MonitorMetrics;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Combines the change-detector and baseline signals of each completed window into an
 * {@link Alert}, keeps the run counters, and publishes the alert to the application's
 * event listeners. This is the only place per-window output is produced.
 *
 * <p>Not thread-safe: confined to the monitor control thread.
 */
public class AlertEngine {

    private final ApplicationEventPublisher publisher;
    private final MonitorMetrics metrics;

    // Written by the control thread only; volatile so health checks read a current value.
    private volatile long totalObservations = 0;
    private volatile long totalWindows = 0;
    private volatile long driftWindows = 0;
    private volatile long skippedLines = 0;
    private volatile Double baselineMean;

    public AlertEngine(ApplicationEventPublisher publisher, MonitorMetrics metrics) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public void recordObservation() {
        totalObservations++;
        metrics.incrementObservations();
    }

    public void recordSkippedLine() {
        skippedLines++;
        metrics.incrementSkippedLines();
    }

    /**
     * Builds and publishes the alert for a completed window.
     *
     * @param window the completed window
     * @param adwinTriggered whether the change detector flagged a change during this window
     * @param baseline the baseline comparison for this window
     * @return the published alert
     */
    public Alert onWindowComplete(Window window, boolean adwinTriggered, BaselineResult baseline) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");

        boolean driftDetected = adwinTriggered || baseline.triggered();
        totalWindows++;
        baselineMean = baseline.baselineMean();
        metrics.incrementWindows();
        if (driftDetected) {
            driftWindows++;
            if (adwinTriggered) {
                metrics.incrementDriftWindows("adwin");
            }
            if (baseline.triggered()) {
                metrics.incrementDriftWindows("baseline");
            }
        }

        Alert alert = new Alert(
                window.id(),
                window.lastTimestamp(),
                driftDetected,
                adwinTriggered,
                baseline.triggered(),
                round6(baseline.driftStatistic()),
                round6(baseline.baselineMean()),
                round6(window.mean()),
                round6(window.stddev()),
                window.size(),
                message(driftDetected, adwinTriggered, baseline, window.mean()));
        publisher.publishEvent(alert);
        return alert;
    }

    public StatusSnapshot status(String windowProgress, Instant at) {
        double rate = totalWindows == 0 ? 0.0 : 100.0 * driftWindows / totalWindows;
        return new StatusSnapshot(totalObservations, totalWindows, driftWindows, rate,
                windowProgress, skippedLines, at);
    }

    public RunSummary summary() {
        return new RunSummary(totalObservations, totalWindows, driftWindows, skippedLines,
                baselineMean == null ? null : round6(baselineMean));
    }

    public long totalObservations() {
        return totalObservations;
    }

    public long totalWindows() {
        return totalWindows;
    }

    public long driftWindows() {
        return driftWindows;
    }

    public long skippedLines() {
        return skippedLines;
    }

    static String message(boolean driftDetected, boolean adwinTriggered, BaselineResult baseline,
                          double currentMean) {
        double base = baseline.baselineMean();
        if (!driftDetected) {
            return String.format(Locale.ROOT, "Stable - Mean: %.4f, Baseline: %.4f", currentMean, base);
        }
        List<String> signals = new ArrayList<>(2);
        if (adwinTriggered) {
            signals.add("ADWIN");
        }
        if (baseline.triggered()) {
            signals.add("Baseline");
        }
        double changePct = base != 0.0 ? baseline.driftStatistic() / base * 100.0 : 0.0;
        return String.format(Locale.ROOT, "DRIFT DETECTED [%s]! Mean shifted from %.4f to %.4f (%+.1f%%)",
                String.join(", ", signals), base, currentMean, changePct);
    }

    private static double round6(double v) {
        return Math.round(v * 1_000_000d) / 1_000_000d;
    }
}
