package com.phillippitts.driftwatch.domain;

import org.json.JSONObject;

import java.time.Instant;
import java.util.Locale;

/**
 * Periodic progress report. Suppressed entirely in quiet mode.
 *
 * @param observationsProcessed observations decoded so far
 * @param windowsAnalyzed completed windows so far
 * @param driftCount windows flagged as drifting
 * @param driftRate percentage of windows flagged (0-100)
 * @param currentWindowProgress fill of the open window, e.g. {@code "40/100"}
 * @param skippedLines lines rejected by the decoder
 * @param at when the snapshot was taken
 */
public record StatusSnapshot(
        long observationsProcessed,
        long windowsAnalyzed,
        long driftCount,
        double driftRate,
        String currentWindowProgress,
        long skippedLines,
        Instant at
) {

    public String formattedDriftRate() {
        return String.format(Locale.ROOT, "%.1f%%", driftRate);
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("type", "status")
                .put("observations_processed", observationsProcessed)
                .put("windows_analyzed", windowsAnalyzed)
                .put("drift_count", driftCount)
                .put("drift_rate", formattedDriftRate())
                .put("current_window_progress", currentWindowProgress)
                .put("skipped_lines", skippedLines)
                .put("at", at.toString());
    }
}
