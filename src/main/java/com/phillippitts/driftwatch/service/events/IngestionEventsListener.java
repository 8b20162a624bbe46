package com.phillippitts.driftwatch.service.events;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.service.ingest.IngestionFaultEvent;
import com.phillippitts.driftwatch.service.metrics.MonitorMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for recoverable ingestion faults. Counts every fault and logs it throttled
 * per reason to avoid log spam while a file stays unreadable. In quiet mode the
 * waiting-for-file diagnostic is logged at debug only.
 */
@Component
class IngestionEventsListener {
    private static final Logger LOG = LogManager.getLogger(IngestionEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final MonitorProperties props;
    private final MonitorMetrics metrics;

    IngestionEventsListener(MonitorProperties props, MonitorMetrics metrics) {
        this.props = props;
        this.metrics = metrics;
    }

    @EventListener
    void onIngestionFault(IngestionFaultEvent e) {
        metrics.incrementIngestFault(e.reason().name().toLowerCase(Locale.ROOT));
        if (!shouldLog(e.reason().name(), e.at())) {
            return;
        }
        switch (e.reason()) {
            case WAITING_FOR_FILE -> {
                if (props.isQuiet()) {
                    LOG.debug("Log file does not exist yet: {}", e.path());
                } else {
                    LOG.warn("Log file does not exist yet: {}. Waiting for it to be created...", e.path());
                }
            }
            case IO_ERROR -> LOG.warn("Cannot read {}: {}. Retrying on next poll.", e.path(), e.detail());
            case LINE_TOO_LONG -> LOG.warn("Dropped an over-long line in {} ({})", e.path(), e.detail());
            default -> LOG.warn("Log file {} {} ({}); reading resumes from byte 0",
                    e.path(), e.reason().name().toLowerCase(Locale.ROOT), e.detail());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
