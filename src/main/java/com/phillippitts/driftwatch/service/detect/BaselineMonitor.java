package com.phillippitts.driftwatch.service.detect;

import com.phillippitts.driftwatch.domain.BaselineResult;
import com.phillippitts.driftwatch.domain.Window;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Compares each completed window against a fixed baseline: the mean of the first window.
 *
 * <p>Complements the change detector, which re-adapts after a shift and stops flagging it;
 * this monitor keeps flagging for as long as the mean stays away from the baseline.
 * The threshold is {@code delta * scale} (0.002 * 50 = 0.1 by default).
 *
 * <p>Not thread-safe: confined to the monitor control thread.
 */
public final class BaselineMonitor {

    public static final double DEFAULT_SCALE = 50.0;

    private final double threshold;
    private Double baselineMean;

    public BaselineMonitor(double delta, double scale) {
        if (!(delta > 0.0) || !(scale > 0.0)) {
            throw new IllegalArgumentException("delta and scale must be positive, got: "
                    + delta + ", " + scale);
        }
        this.threshold = delta * scale;
    }

    /**
     * Evaluates a completed window. The first window becomes the baseline and never triggers.
     *
     * @param window completed window
     * @return drift statistic, whether it exceeded the threshold, and the baseline in effect
     */
    public BaselineResult evaluate(Window window) {
        Objects.requireNonNull(window, "window must not be null");
        if (baselineMean == null) {
            baselineMean = window.mean();
            return new BaselineResult(0.0, false, baselineMean);
        }
        double statistic = Math.abs(window.mean() - baselineMean);
        return new BaselineResult(statistic, statistic > threshold, baselineMean);
    }

    public OptionalDouble baselineMean() {
        return baselineMean == null ? OptionalDouble.empty() : OptionalDouble.of(baselineMean);
    }

    public double threshold() {
        return threshold;
    }
}
