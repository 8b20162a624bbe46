package com.phillippitts.driftwatch.service.ingest;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.exception.InvalidConfigurationException;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Resolves which file to monitor: the configured {@code drift.monitor.log-file}, or with
 * {@code auto-detect} the producer's daily file {@code predictions_yyyyMMdd.jsonl} for today.
 */
public final class LogFileResolver {

    static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    public LogFileResolver(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Path resolve(MonitorProperties props) {
        if (props.getLogFile() != null) {
            return props.getLogFile();
        }
        if (props.isAutoDetect()) {
            return props.getLogDirectory().resolve("predictions_" + LocalDate.now(clock).format(DAY) + ".jsonl");
        }
        throw new InvalidConfigurationException("drift.monitor.log-file",
                "must be set unless drift.monitor.auto-detect=true");
    }
}
