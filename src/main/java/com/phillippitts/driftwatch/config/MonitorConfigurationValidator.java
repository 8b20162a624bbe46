package com.phillippitts.driftwatch.config;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Validates cross-field monitor settings at startup to fail fast with actionable messages,
 * before any monitor component is built.
 */
@Component
class MonitorConfigurationValidator {

    private final MonitorProperties props;

    MonitorConfigurationValidator(MonitorProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        if (props.getLogFile() == null && !props.isAutoDetect()) {
            throw new InvalidConfigurationException("drift.monitor.log-file",
                    "must be set unless drift.monitor.auto-detect=true");
        }
        if (props.isAutoDetect() && props.getLogFile() == null && props.getLogDirectory() == null) {
            throw new InvalidConfigurationException("drift.monitor.log-directory",
                    "required when drift.monitor.auto-detect=true");
        }
        if (props.getWindowSize() <= 0) {
            throw new InvalidConfigurationException("drift.monitor.window-size",
                    "must be a positive integer, got: " + props.getWindowSize());
        }
        if (!(props.getDelta() > 0.0 && props.getDelta() < 1.0)) {
            throw new InvalidConfigurationException("drift.monitor.delta",
                    "must be in (0, 1), got: " + props.getDelta());
        }
        if (!(props.getThresholdScale() > 0.0)) {
            throw new InvalidConfigurationException("drift.monitor.threshold-scale",
                    "must be positive, got: " + props.getThresholdScale());
        }
        requirePositive("drift.monitor.poll-interval", props.getPollInterval());
        requirePositive("drift.monitor.status-interval", props.getStatusInterval());
    }

    private static void requirePositive(String property, Duration value) {
        if (value == null || value.toMillis() < 1) {
            throw new InvalidConfigurationException(property, "must be at least 1ms, got: " + value);
        }
    }
}
