package com.phillippitts.driftwatch.domain;

import org.json.JSONObject;

import java.util.Locale;

/**
 * Final counters, published exactly once when the monitor stops. Only completed windows are
 * counted; a partially filled window is never flushed.
 *
 * @param totalObservations observations decoded over the run
 * @param totalWindows completed windows
 * @param driftWindows completed windows flagged as drifting
 * @param skippedLines lines rejected by the decoder
 * @param baselineMean mean of window 0, or {@code null} if no window completed
 */
public record RunSummary(
        long totalObservations,
        long totalWindows,
        long driftWindows,
        long skippedLines,
        Double baselineMean
) {

    /** Percentage of completed windows flagged as drifting; 0 when no window completed. */
    public double detectionRate() {
        return totalWindows == 0 ? 0.0 : 100.0 * driftWindows / totalWindows;
    }

    public String formattedDetectionRate() {
        return String.format(Locale.ROOT, "%.1f%%", detectionRate());
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("type", "summary")
                .put("total_observations", totalObservations)
                .put("total_windows", totalWindows)
                .put("drift_windows", driftWindows)
                .put("skipped_lines", skippedLines)
                .put("detection_rate", formattedDetectionRate())
                .put("baseline_mean", baselineMean == null ? JSONObject.NULL : baselineMean);
    }
}
