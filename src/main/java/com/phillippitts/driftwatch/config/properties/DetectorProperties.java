package com.phillippitts.driftwatch.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for the adaptive windowing change detector. The sensitivity itself is
 * {@code drift.monitor.delta}.
 */
@ConfigurationProperties(prefix = "drift.detector")
@Validated
public class DetectorProperties {

    /** Run the cut test every {@code clock} observations. */
    @Positive(message = "Clock must be positive")
    private int clock = 32;

    /** Buckets kept per exponential-histogram row before two are merged. */
    @Positive(message = "Max buckets must be positive")
    private int maxBuckets = 5;

    /** Minimum length of each sub-window compared by the cut test. */
    @Positive(message = "Min window length must be positive")
    private int minWindowLength = 5;

    /** Observations required before the first cut test. */
    @Positive(message = "Grace period must be positive")
    private int gracePeriod = 10;

    public int getClock() {
        return clock;
    }

    public void setClock(int clock) {
        this.clock = clock;
    }

    public int getMaxBuckets() {
        return maxBuckets;
    }

    public void setMaxBuckets(int maxBuckets) {
        this.maxBuckets = maxBuckets;
    }

    public int getMinWindowLength() {
        return minWindowLength;
    }

    public void setMinWindowLength(int minWindowLength) {
        this.minWindowLength = minWindowLength;
    }

    public int getGracePeriod() {
        return gracePeriod;
    }

    public void setGracePeriod(int gracePeriod) {
        this.gracePeriod = gracePeriod;
    }
}
