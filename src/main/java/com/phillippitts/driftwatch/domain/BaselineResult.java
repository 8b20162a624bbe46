package com.phillippitts.driftwatch.domain;

/**
 * Outcome of comparing one window against the baseline.
 *
 * @param driftStatistic |window mean - baseline mean|; 0 for the baseline window itself
 * @param triggered whether the statistic exceeded the threshold
 * @param baselineMean the baseline in effect (the mean of window 0)
 */
public record BaselineResult(double driftStatistic, boolean triggered, double baselineMean) {
}
