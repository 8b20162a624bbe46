package com.phillippitts.driftwatch.service.orchestration;

import com.phillippitts.driftwatch.domain.Alert;
import com.phillippitts.driftwatch.domain.BaselineResult;
import com.phillippitts.driftwatch.domain.Observation;
import com.phillippitts.driftwatch.domain.RunSummary;
import com.phillippitts.driftwatch.domain.StatusSnapshot;
import com.phillippitts.driftwatch.domain.Window;
import com.phillippitts.driftwatch.service.alert.AlertEngine;
import com.phillippitts.driftwatch.service.decode.DecodeResult;
import com.phillippitts.driftwatch.service.decode.RecordDecoder;
import com.phillippitts.driftwatch.service.detect.BaselineMonitor;
import com.phillippitts.driftwatch.service.detect.ChangeDetector;
import com.phillippitts.driftwatch.service.window.WindowAggregator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The monitor's detection state: decoder, tumbling window, change detector, baseline and alert
 * engine, owned together and driven one line at a time.
 *
 * <p>Every value goes to the change detector as well as to the window. A detector flag is latched
 * until the window completes, so {@code adwinTriggered} on an alert means "a change was flagged
 * at some point during this window".
 *
 * <p>Not thread-safe: confined to the monitor control thread.
 */
public class MonitorPipeline {

    private static final Logger LOG = LogManager.getLogger(MonitorPipeline.class);

    private final RecordDecoder decoder;
    private final WindowAggregator aggregator;
    private final ChangeDetector detector;
    private final BaselineMonitor baseline;
    private final AlertEngine alertEngine;
    private final boolean quiet;

    private boolean changeSinceLastWindow = false;

    public MonitorPipeline(RecordDecoder decoder,
                           WindowAggregator aggregator,
                           ChangeDetector detector,
                           BaselineMonitor baseline,
                           AlertEngine alertEngine,
                           boolean quiet) {
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null");
        this.alertEngine = Objects.requireNonNull(alertEngine, "alertEngine must not be null");
        this.quiet = quiet;
    }

    /**
     * Decodes and processes one raw line.
     *
     * @param line raw line from the log
     * @return the alert if this line completed a window
     */
    public Optional<Alert> process(String line) {
        DecodeResult result = decoder.decode(line);
        if (result.isBlank()) {
            return Optional.empty();
        }
        if (result.isError()) {
            alertEngine.recordSkippedLine();
            if (quiet) {
                LOG.debug("Skipped line ({}): {}", result.error().reason(), result.error().linePreview());
            } else {
                LOG.warn("Skipped line ({}): {}", result.error().reason(), result.error().linePreview());
            }
            return Optional.empty();
        }
        return observe(result.observation());
    }

    Optional<Alert> observe(Observation observation) {
        alertEngine.recordObservation();
        if (detector.observe(observation.value())) {
            LOG.debug("Change detector flagged a change at window {} ({})",
                    aggregator.currentWindowId(), aggregator.progress());
            changeSinceLastWindow = true;
        }
        Optional<Window> completed = aggregator.observe(observation);
        if (completed.isEmpty()) {
            return Optional.empty();
        }
        Window window = completed.get();
        BaselineResult baselineResult = baseline.evaluate(window);
        boolean adwinTriggered = changeSinceLastWindow;
        changeSinceLastWindow = false;
        return Optional.of(alertEngine.onWindowComplete(window, adwinTriggered, baselineResult));
    }

    public StatusSnapshot status(Instant at) {
        return alertEngine.status(aggregator.progress(), at);
    }

    public RunSummary summary() {
        return alertEngine.summary();
    }

    public String windowProgress() {
        return aggregator.progress();
    }

    public int windowCapacity() {
        return aggregator.capacity();
    }
}
