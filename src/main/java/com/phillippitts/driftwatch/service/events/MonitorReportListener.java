package com.phillippitts.driftwatch.service.events;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.domain.Alert;
import com.phillippitts.driftwatch.domain.RunSummary;
import com.phillippitts.driftwatch.domain.StatusSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Console presentation of the monitor's output events. Alerts are always rendered; status
 * events only arrive when quiet mode is off.
 *
 * <p>With {@code drift.monitor.json-events=true} each event is also written as one JSON line to
 * the {@code driftwatch.events} logger for machine consumers.
 */
@Component
public class MonitorReportListener {

    private static final Logger LOG = LogManager.getLogger(MonitorReportListener.class);
    private static final Logger EVENTS = LogManager.getLogger("driftwatch.events");

    private static final String RULE = "=".repeat(70);
    private static final String THIN_RULE = "-".repeat(70);

    private final MonitorProperties props;

    public MonitorReportListener(MonitorProperties props) {
        this.props = props;
    }

    @EventListener
    public void onAlert(Alert alert) {
        String text = formatAlert(alert);
        if (alert.driftDetected()) {
            LOG.warn(text);
        } else {
            LOG.info(text);
        }
        if (props.isJsonEvents()) {
            EVENTS.info(alert.toJson().toString());
        }
    }

    @EventListener
    public void onStatus(StatusSnapshot status) {
        LOG.info(formatStatus(status));
        if (props.isJsonEvents()) {
            EVENTS.info(status.toJson().toString());
        }
    }

    @EventListener
    public void onSummary(RunSummary summary) {
        LOG.info(formatSummary(summary));
        if (props.isJsonEvents()) {
            EVENTS.info(summary.toJson().toString());
        }
    }

    String formatAlert(Alert a) {
        StringBuilder sb = new StringBuilder("\n").append(RULE).append('\n');
        sb.append(a.driftDetected() ? "DRIFT ALERT - Window " : "Window ").append(a.windowId())
                .append(a.driftDetected() ? "" : " Complete").append('\n');
        sb.append(RULE).append('\n');
        line(sb, "Timestamp:", a.timestamp());
        line(sb, "Status:", a.driftDetected() ? "DRIFT DETECTED" : "STABLE");
        line(sb, "Drift Statistic:", fmt(a.driftStatistic()));
        line(sb, "Baseline Mean:", fmt(a.baselineMean()));
        line(sb, "Current Mean:", fmt(a.currentMean()));
        line(sb, "Current Std:", fmt(a.currentStddev()));
        line(sb, "Observations:", String.valueOf(a.observationCount()));
        sb.append('\n').append(a.message()).append('\n').append(RULE);
        return sb.toString();
    }

    String formatStatus(StatusSnapshot s) {
        StringBuilder sb = new StringBuilder("\n").append(THIN_RULE).append('\n');
        sb.append("Status Update - ").append(s.at()).append('\n').append(THIN_RULE).append('\n');
        line(sb, "Observations processed:", String.valueOf(s.observationsProcessed()));
        line(sb, "Windows analyzed:", String.valueOf(s.windowsAnalyzed()));
        line(sb, "Drift detected:", s.driftCount() + " (" + s.formattedDriftRate() + ")");
        line(sb, "Current window:", s.currentWindowProgress() + " observations");
        line(sb, "Skipped lines:", String.valueOf(s.skippedLines()));
        sb.append(THIN_RULE);
        return sb.toString();
    }

    String formatSummary(RunSummary s) {
        StringBuilder sb = new StringBuilder("\n").append(RULE).append('\n');
        sb.append("FINAL SUMMARY\n").append(RULE).append('\n');
        line(sb, "Total observations:", String.valueOf(s.totalObservations()));
        line(sb, "Total windows:", String.valueOf(s.totalWindows()));
        line(sb, "Drift detected:", s.driftWindows() + " windows");
        line(sb, "Detection rate:", s.formattedDetectionRate());
        line(sb, "Skipped lines:", String.valueOf(s.skippedLines()));
        if (s.baselineMean() != null) {
            line(sb, "Baseline mean:", fmt(s.baselineMean()));
        }
        sb.append(RULE);
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format(Locale.ROOT, "%-24s %s%n", label, value));
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6f", v);
    }
}
