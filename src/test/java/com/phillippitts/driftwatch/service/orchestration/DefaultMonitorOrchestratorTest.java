package com.phillippitts.driftwatch.service.orchestration;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.domain.Alert;
import com.phillippitts.driftwatch.domain.RunSummary;
import com.phillippitts.driftwatch.domain.StatusSnapshot;
import com.phillippitts.driftwatch.service.alert.AlertEngine;
import com.phillippitts.driftwatch.service.decode.JsonRecordDecoder;
import com.phillippitts.driftwatch.service.detect.AdaptiveWindowingDetector;
import com.phillippitts.driftwatch.service.detect.BaselineMonitor;
import com.phillippitts.driftwatch.service.ingest.FileChangeWatcher;
import com.phillippitts.driftwatch.service.ingest.IngestionFaultEvent;
import com.phillippitts.driftwatch.service.ingest.LineSource;
import com.phillippitts.driftwatch.service.ingest.TailingLineSource;
import com.phillippitts.driftwatch.service.ingest.WakeSignal;
import com.phillippitts.driftwatch.service.metrics.MonitorMetrics;
import com.phillippitts.driftwatch.service.window.WindowAggregator;
import com.phillippitts.driftwatch.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static com.phillippitts.driftwatch.testutil.MonitorFixtures.fastProperties;
import static com.phillippitts.driftwatch.testutil.MonitorFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultMonitorOrchestratorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path dir;

    private Path file;
    private EventCapturingPublisher publisher;
    private DefaultMonitorOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        file = dir.resolve("predictions.jsonl");
        publisher = new EventCapturingPublisher();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.stop();
        }
    }

    private DefaultMonitorOrchestrator orchestrator(MonitorProperties props, boolean watch) {
        Clock clock = Clock.systemUTC();
        WakeSignal wake = new WakeSignal();
        FileChangeWatcher watcher = watch ? new FileChangeWatcher(file, wake, props.getPollInterval()) : null;
        orchestrator = new DefaultMonitorOrchestrator(props,
                new TailingLineSource(file, props.isFromBeginning(), publisher, clock),
                pipeline(props), wake, watcher, new MonitorStateMachine(), publisher, clock);
        return orchestrator;
    }

    private MonitorPipeline pipeline(MonitorProperties props) {
        Clock clock = Clock.systemUTC();
        MonitorMetrics metrics = new MonitorMetrics(new SimpleMeterRegistry());
        return new MonitorPipeline(
                new JsonRecordDecoder(clock, props.getMaxLinePreview()),
                new WindowAggregator(props.getWindowSize()),
                new AdaptiveWindowingDetector(props.getDelta()),
                new BaselineMonitor(props.getDelta(), props.getThresholdScale()),
                new AlertEngine(publisher, metrics),
                props.isQuiet());
    }

    private long ioErrors() {
        return publisher.eventsOfType(IngestionFaultEvent.class).stream()
                .filter(e -> e.reason() == IngestionFaultEvent.Reason.IO_ERROR)
                .count();
    }

    private void append(int count, double value) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(record(value)).append('\n');
        }
        Files.writeString(file, sb.toString(), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Test
    void waitsForFileThenProcessesItFromTheStart() throws Exception {
        DefaultMonitorOrchestrator monitor = orchestrator(fastProperties(file, 10), false);

        monitor.start();
        await().atMost(TIMEOUT).until(() -> monitor.state() == MonitorState.WAITING);

        append(50, 0.5);

        await().atMost(TIMEOUT).until(() -> publisher.eventsOfType(Alert.class).size() == 5);
        assertThat(monitor.state()).isEqualTo(MonitorState.ACTIVE);
        assertThat(publisher.eventsOfType(Alert.class)).extracting(Alert::windowId)
                .containsExactly(0L, 1L, 2L, 3L, 4L);

        monitor.requestStop();
        assertThat(monitor.awaitTermination(TIMEOUT)).isTrue();

        assertThat(monitor.state()).isEqualTo(MonitorState.STOPPED);
        assertThat(publisher.eventsOfType(RunSummary.class)).singleElement().satisfies(s -> {
            assertThat(s.totalObservations()).isEqualTo(50);
            assertThat(s.totalWindows()).isEqualTo(5);
            assertThat(s.driftWindows()).isZero();
        });
    }

    @Test
    void tailsOnlyNewLinesOfExistingFile() throws Exception {
        append(25, 0.1);
        DefaultMonitorOrchestrator monitor = orchestrator(fastProperties(file, 10), true);

        monitor.start();
        await().atMost(TIMEOUT).until(() -> monitor.state() == MonitorState.ACTIVE);
        append(10, 0.2);

        await().atMost(TIMEOUT).until(() -> publisher.eventsOfType(Alert.class).size() == 1);
        assertThat(publisher.eventsOfType(Alert.class).get(0).currentMean()).isEqualTo(0.2);
    }

    @Test
    void sustainedShiftIsReportedAsDrift() throws Exception {
        MonitorProperties props = fastProperties(file, 10);
        props.setFromBeginning(true);
        append(30, 0.08);
        append(20, 0.5);
        DefaultMonitorOrchestrator monitor = orchestrator(props, false);

        monitor.start();

        await().atMost(TIMEOUT).until(() -> publisher.eventsOfType(Alert.class).size() == 5);
        assertThat(publisher.eventsOfType(Alert.class)).extracting(Alert::baselineTriggered)
                .containsExactly(false, false, false, true, true);
    }

    @Test
    void partialWindowIsLeftIncompleteOnStop() throws Exception {
        MonitorProperties props = fastProperties(file, 100);
        props.setFromBeginning(true);
        append(40, 0.5);
        DefaultMonitorOrchestrator monitor = orchestrator(props, false);

        monitor.start();
        await().atMost(TIMEOUT).until(() -> monitor.state() == MonitorState.ACTIVE);
        monitor.stop();

        assertThat(monitor.state()).isEqualTo(MonitorState.STOPPED);
        assertThat(publisher.eventsOfType(Alert.class)).isEmpty();
        assertThat(publisher.eventsOfType(RunSummary.class)).singleElement().satisfies(s -> {
            assertThat(s.totalObservations()).isEqualTo(40);
            assertThat(s.totalWindows()).isZero();
            assertThat(s.baselineMean()).isNull();
        });
    }

    @Test
    void summaryIsPublishedExactlyOnceAcrossRepeatedStops() throws Exception {
        DefaultMonitorOrchestrator monitor = orchestrator(fastProperties(file, 10), false);
        monitor.start();
        await().atMost(TIMEOUT).until(() -> monitor.state() == MonitorState.WAITING);

        monitor.requestStop();
        monitor.requestStop();
        monitor.stop();
        monitor.stop();

        assertThat(monitor.isRunning()).isFalse();
        assertThat(publisher.eventsOfType(RunSummary.class)).hasSize(1);
    }

    @Test
    void stopBeforeStartStillPublishesSummary() {
        DefaultMonitorOrchestrator monitor = orchestrator(fastProperties(file, 10), false);

        monitor.stop();
        monitor.stop();

        assertThat(monitor.state()).isEqualTo(MonitorState.STOPPED);
        assertThat(publisher.eventsOfType(RunSummary.class)).hasSize(1);
    }

    @Test
    void publishesStatusUnlessQuiet() throws Exception {
        MonitorProperties props = fastProperties(file, 10);
        props.setStatusInterval(Duration.ofMillis(50));
        DefaultMonitorOrchestrator monitor = orchestrator(props, false);

        monitor.start();

        await().atMost(TIMEOUT).until(() -> !publisher.eventsOfType(StatusSnapshot.class).isEmpty());
    }

    @Test
    void quietModeSuppressesStatus() throws Exception {
        MonitorProperties props = fastProperties(file, 10);
        props.setQuiet(true);
        props.setStatusInterval(Duration.ofMillis(10));
        append(10, 0.5);
        props.setFromBeginning(true);
        DefaultMonitorOrchestrator monitor = orchestrator(props, false);

        monitor.start();
        await().atMost(TIMEOUT).until(() -> publisher.eventsOfType(Alert.class).size() == 1);
        Thread.sleep(300);
        monitor.stop();

        assertThat(publisher.eventsOfType(StatusSnapshot.class)).isEmpty();
        assertThat(publisher.eventsOfType(RunSummary.class)).hasSize(1);
    }

    @Test
    void tickRecoversAfterFileVanishes() throws Exception {
        DefaultMonitorOrchestrator monitor = orchestrator(fastProperties(file, 5), false);
        Files.writeString(file, "");

        monitor.tick();
        assertThat(monitor.state()).isEqualTo(MonitorState.ACTIVE);

        Files.delete(file);
        monitor.tick();
        assertThat(monitor.state()).isEqualTo(MonitorState.WAITING);

        append(5, 0.3);
        monitor.tick();
        assertThat(monitor.state()).isEqualTo(MonitorState.ACTIVE);
        assertThat(publisher.eventsOfType(Alert.class)).hasSize(1);
    }

    @Test
    void readFaultsAreReportedAndRetriedUntilTheFileIsReadable() throws Exception {
        Files.createDirectory(file);
        DefaultMonitorOrchestrator monitor = orchestrator(fastProperties(file, 10), false);

        monitor.start();
        await().atMost(TIMEOUT).until(() -> ioErrors() >= 3);
        assertThat(monitor.isRunning()).isTrue();
        assertThat(monitor.state()).isEqualTo(MonitorState.WAITING);

        Files.delete(file);
        append(20, 0.4);

        await().atMost(TIMEOUT).until(() -> publisher.eventsOfType(Alert.class).size() == 2);
        assertThat(monitor.state()).isEqualTo(MonitorState.ACTIVE);
        assertThat(publisher.eventsOfType(RunSummary.class)).isEmpty();
    }

    @Test
    void tickDrainsBacklogChunkByChunk() {
        MonitorProperties props = fastProperties(file, 4);
        LineSource source = mock(LineSource.class);
        when(source.path()).thenReturn(file);
        when(source.state()).thenReturn(LineSource.SourceState.OPEN);
        when(source.poll()).thenReturn(
                List.of(record(0.1), record(0.1)),
                List.of(record(0.1), record(0.1)),
                List.of());
        when(source.hasBacklog()).thenReturn(true, false);
        orchestrator = new DefaultMonitorOrchestrator(props, source, pipeline(props), new WakeSignal(), null,
                new MonitorStateMachine(), publisher, Clock.systemUTC());

        orchestrator.tick();

        verify(source, times(2)).poll();
        assertThat(publisher.eventsOfType(Alert.class)).hasSize(1);
        assertThat(orchestrator.state()).isEqualTo(MonitorState.ACTIVE);
    }
}
