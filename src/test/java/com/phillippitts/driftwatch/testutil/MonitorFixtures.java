package com.phillippitts.driftwatch.testutil;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/** Shared builders for monitor tests. */
public final class MonitorFixtures {

    private MonitorFixtures() {}

    public static String record(double value) {
        return String.format(Locale.ROOT, "{\"timestamp\": \"2025-12-14T10:00:00Z\", \"value\": %s}", value);
    }

    public static String record(String timestamp, double value) {
        return String.format(Locale.ROOT, "{\"timestamp\": \"%s\", \"value\": %s}", timestamp, value);
    }

    /** Properties tuned for fast tests: small windows, 50ms polling. */
    public static MonitorProperties fastProperties(Path logFile, int windowSize) {
        MonitorProperties props = new MonitorProperties();
        props.setLogFile(logFile);
        props.setWindowSize(windowSize);
        props.setPollInterval(Duration.ofMillis(50));
        props.setStatusInterval(Duration.ofMinutes(10));
        return props;
    }
}
