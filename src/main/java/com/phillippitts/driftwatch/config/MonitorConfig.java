package com.phillippitts.driftwatch.config;

import com.phillippitts.driftwatch.config.properties.DetectorProperties;
import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.service.alert.AlertEngine;
import com.phillippitts.driftwatch.service.decode.JsonRecordDecoder;
import com.phillippitts.driftwatch.service.decode.RecordDecoder;
import com.phillippitts.driftwatch.service.detect.AdaptiveWindowingDetector;
import com.phillippitts.driftwatch.service.detect.BaselineMonitor;
import com.phillippitts.driftwatch.service.detect.ChangeDetector;
import com.phillippitts.driftwatch.service.ingest.FileChangeWatcher;
import com.phillippitts.driftwatch.service.ingest.LineSource;
import com.phillippitts.driftwatch.service.ingest.LogFileResolver;
import com.phillippitts.driftwatch.service.ingest.TailingLineSource;
import com.phillippitts.driftwatch.service.ingest.WakeSignal;
import com.phillippitts.driftwatch.service.metrics.MonitorMetrics;
import com.phillippitts.driftwatch.service.orchestration.DefaultMonitorOrchestrator;
import com.phillippitts.driftwatch.service.orchestration.MonitorPipeline;
import com.phillippitts.driftwatch.service.orchestration.MonitorStateMachine;
import com.phillippitts.driftwatch.service.window.WindowAggregator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the monitor explicitly. All detection state lives in beans created here and handed to
 * the orchestrator; there is no ambient global state.
 *
 * <p>Depends on {@code monitorConfigurationValidator} so configuration faults surface before any
 * component is built.
 */
@Configuration
@DependsOn("monitorConfigurationValidator")
public class MonitorConfig {

    private final MonitorProperties monitorProperties;
    private final DetectorProperties detectorProperties;
    private final ApplicationEventPublisher publisher;

    public MonitorConfig(MonitorProperties monitorProperties,
                         DetectorProperties detectorProperties,
                         ApplicationEventPublisher publisher) {
        this.monitorProperties = monitorProperties;
        this.detectorProperties = detectorProperties;
        this.publisher = publisher;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * The file being monitored, resolved once at startup.
     */
    @Bean
    public Path monitoredLogFile(Clock clock) {
        return new LogFileResolver(clock).resolve(monitorProperties);
    }

    @Bean
    public WakeSignal wakeSignal() {
        return new WakeSignal();
    }

    @Bean
    public LineSource lineSource(Path monitoredLogFile, Clock clock) {
        return new TailingLineSource(monitoredLogFile, monitorProperties.isFromBeginning(), publisher, clock);
    }

    /**
     * OS notification source. Disable with {@code drift.monitor.watch-enabled=false} to run poll-only.
     */
    @Bean
    @ConditionalOnProperty(prefix = "drift.monitor", name = "watch-enabled", havingValue = "true", matchIfMissing = true)
    public FileChangeWatcher fileChangeWatcher(Path monitoredLogFile, WakeSignal wakeSignal) {
        return new FileChangeWatcher(monitoredLogFile, wakeSignal, monitorProperties.getPollInterval());
    }

    @Bean
    public RecordDecoder recordDecoder(Clock clock) {
        return new JsonRecordDecoder(clock, monitorProperties.getMaxLinePreview());
    }

    @Bean
    public ChangeDetector changeDetector() {
        return new AdaptiveWindowingDetector(
                monitorProperties.getDelta(),
                detectorProperties.getClock(),
                detectorProperties.getMaxBuckets(),
                detectorProperties.getMinWindowLength(),
                detectorProperties.getGracePeriod());
    }

    @Bean
    public BaselineMonitor baselineMonitor() {
        return new BaselineMonitor(monitorProperties.getDelta(), monitorProperties.getThresholdScale());
    }

    @Bean
    public AlertEngine alertEngine(MonitorMetrics metrics) {
        return new AlertEngine(publisher, metrics);
    }

    @Bean
    public WindowAggregator windowAggregator() {
        return new WindowAggregator(monitorProperties.getWindowSize());
    }

    @Bean
    public MonitorPipeline monitorPipeline(RecordDecoder recordDecoder,
                                           WindowAggregator windowAggregator,
                                           ChangeDetector changeDetector,
                                           BaselineMonitor baselineMonitor,
                                           AlertEngine alertEngine) {
        return new MonitorPipeline(recordDecoder, windowAggregator, changeDetector, baselineMonitor, alertEngine, monitorProperties.isQuiet());
    }

    @Bean
    public MonitorStateMachine monitorStateMachine() {
        return new MonitorStateMachine();
    }

    @Bean
    public DefaultMonitorOrchestrator monitorOrchestrator(LineSource lineSource,
                                                          MonitorPipeline monitorPipeline,
                                                          WakeSignal wakeSignal,
                                                          ObjectProvider<FileChangeWatcher> fileChangeWatcher,
                                                          MonitorStateMachine monitorStateMachine,
                                                          Clock clock) {
        return new DefaultMonitorOrchestrator(monitorProperties, lineSource, monitorPipeline, wakeSignal,
                fileChangeWatcher.getIfAvailable(), monitorStateMachine, publisher, clock);
    }
}
