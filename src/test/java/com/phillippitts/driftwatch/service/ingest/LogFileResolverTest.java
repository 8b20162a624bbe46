package com.phillippitts.driftwatch.service.ingest;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogFileResolverTest {

    private final LogFileResolver resolver =
            new LogFileResolver(Clock.fixed(Instant.parse("2025-12-14T08:30:00Z"), ZoneOffset.UTC));

    @Test
    void explicitLogFileWins() {
        MonitorProperties props = new MonitorProperties();
        props.setLogFile(Path.of("/var/log/model/p.jsonl"));
        props.setAutoDetect(true);

        assertThat(resolver.resolve(props)).isEqualTo(Path.of("/var/log/model/p.jsonl"));
    }

    @Test
    void autoDetectResolvesTodaysDailyFile() {
        MonitorProperties props = new MonitorProperties();
        props.setAutoDetect(true);
        props.setLogDirectory(Path.of("logs"));

        assertThat(resolver.resolve(props)).isEqualTo(Path.of("logs", "predictions_20251214.jsonl"));
    }

    @Test
    void failsWithoutLogFileOrAutoDetect() {
        assertThatThrownBy(() -> resolver.resolve(new MonitorProperties()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("drift.monitor.log-file");
    }
}
