package com.phillippitts.driftwatch.domain;

import org.json.JSONObject;

/**
 * Per-window drift verdict. One is published for every completed window, drifting or not.
 *
 * <p>{@code driftDetected} is {@code adwinTriggered || baselineTriggered}; the two flags tell
 * consumers which signal fired.
 */
public record Alert(
        long windowId,
        String timestamp,
        boolean driftDetected,
        boolean adwinTriggered,
        boolean baselineTriggered,
        double driftStatistic,
        double baselineMean,
        double currentMean,
        double currentStddev,
        int observationCount,
        String message
) {

    public JSONObject toJson() {
        return new JSONObject()
                .put("type", "alert")
                .put("window_id", windowId)
                .put("timestamp", timestamp)
                .put("drift_detected", driftDetected)
                .put("adwin_triggered", adwinTriggered)
                .put("baseline_triggered", baselineTriggered)
                .put("drift_statistic", driftStatistic)
                .put("baseline_mean", baselineMean)
                .put("current_mean", currentMean)
                .put("current_stddev", currentStddev)
                .put("observation_count", observationCount)
                .put("message", message);
    }
}
