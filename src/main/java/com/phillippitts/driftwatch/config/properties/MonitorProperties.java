package com.phillippitts.driftwatch.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the real-time drift monitor.
 *
 * <p>Bound from the {@code drift.monitor} prefix; every value may also be passed on the
 * command line, e.g. {@code --drift.monitor.log-file=logs/predictions_20251214.jsonl}.
 * Cross-field rules (log file vs. auto-detect, positive intervals) are enforced at startup by
 * {@code MonitorConfigurationValidator}.
 */
@ConfigurationProperties(prefix = "drift.monitor")
@Validated
public class MonitorProperties {

    /** Prediction log to tail. Required unless {@link #autoDetect} is set. */
    private Path logFile;

    /** Resolve today's {@code predictions_yyyyMMdd.jsonl} inside {@link #logDirectory}. */
    private boolean autoDetect = false;

    /** Directory searched when auto-detecting the log file. */
    @NotNull
    private Path logDirectory = Path.of("logs");

    /** Number of observations per tumbling window. */
    @Positive(message = "Window size must be positive")
    private int windowSize = 100;

    /** Sensitivity delta shared by the change detector and the baseline threshold. */
    @Positive(message = "Delta must be positive")
    private double delta = 0.002;

    /** Baseline threshold is {@code delta * thresholdScale} (0.002 * 50 = 0.1). */
    @Positive(message = "Threshold scale must be positive")
    private double thresholdScale = 50.0;

    /** Suppress status events and ingestion diagnostics; alerts are always emitted. */
    private boolean quiet = false;

    /** Process content already in the file instead of tailing from its end. */
    private boolean fromBeginning = false;

    /** Fallback poll interval; also bounds detection latency when notifications never fire. */
    @NotNull
    private Duration pollInterval = Duration.ofSeconds(2);

    /** Interval between status events. */
    @NotNull
    private Duration statusInterval = Duration.ofSeconds(60);

    /** Enable the file-system notification source in addition to polling. */
    private boolean watchEnabled = true;

    /** Maximum characters of an offending line kept in a decode error. */
    @Positive(message = "Max line preview must be positive")
    private int maxLinePreview = 200;

    /** Also write every alert, status and summary as one JSON line to the driftwatch.events logger. */
    private boolean jsonEvents = false;

    public Path getLogFile() {
        return logFile;
    }

    public void setLogFile(Path logFile) {
        this.logFile = logFile;
    }

    public boolean isAutoDetect() {
        return autoDetect;
    }

    public void setAutoDetect(boolean autoDetect) {
        this.autoDetect = autoDetect;
    }

    public Path getLogDirectory() {
        return logDirectory;
    }

    public void setLogDirectory(Path logDirectory) {
        this.logDirectory = logDirectory;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getDelta() {
        return delta;
    }

    public void setDelta(double delta) {
        this.delta = delta;
    }

    public double getThresholdScale() {
        return thresholdScale;
    }

    public void setThresholdScale(double thresholdScale) {
        this.thresholdScale = thresholdScale;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }

    public boolean isFromBeginning() {
        return fromBeginning;
    }

    public void setFromBeginning(boolean fromBeginning) {
        this.fromBeginning = fromBeginning;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getStatusInterval() {
        return statusInterval;
    }

    public void setStatusInterval(Duration statusInterval) {
        this.statusInterval = statusInterval;
    }

    public boolean isWatchEnabled() {
        return watchEnabled;
    }

    public void setWatchEnabled(boolean watchEnabled) {
        this.watchEnabled = watchEnabled;
    }

    public int getMaxLinePreview() {
        return maxLinePreview;
    }

    public void setMaxLinePreview(int maxLinePreview) {
        this.maxLinePreview = maxLinePreview;
    }

    public boolean isJsonEvents() {
        return jsonEvents;
    }

    public void setJsonEvents(boolean jsonEvents) {
        this.jsonEvents = jsonEvents;
    }
}
