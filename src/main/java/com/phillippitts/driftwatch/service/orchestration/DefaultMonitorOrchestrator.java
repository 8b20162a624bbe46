package com.phillippitts.driftwatch.service.orchestration;

import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import com.phillippitts.driftwatch.domain.RunSummary;
import com.phillippitts.driftwatch.exception.LogSourceException;
import com.phillippitts.driftwatch.service.ingest.FileChangeWatcher;
import com.phillippitts.driftwatch.service.ingest.IngestionFaultEvent;
import com.phillippitts.driftwatch.service.ingest.LineSource;
import com.phillippitts.driftwatch.service.ingest.WakeSignal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of {@link MonitorOrchestrator}: a cooperative loop on one dedicated
 * thread that blocks only on {@link WakeSignal#await(Duration)}.
 *
 * <p><b>Wake-ups:</b> the loop reads the log whenever the file watcher signals a change or the
 * poll interval elapses, whichever comes first, so a silent watcher costs at most one poll
 * interval of latency.
 *
 * <p><b>Shutdown:</b> Spring stops this bean when the context closes (including on SIGINT/SIGTERM
 * via Spring Boot's shutdown hook). {@link #stop()} only enqueues a cancellation; the loop
 * observes it, moves to DRAINING, publishes the {@link RunSummary} and ends in STOPPED.
 *
 * @since 1.0
 */
public class DefaultMonitorOrchestrator implements MonitorOrchestrator, SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(DefaultMonitorOrchestrator.class);

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
    static final String THREAD_NAME = "drift-monitor";

    private final MonitorProperties props;
    private final LineSource source;
    private final MonitorPipeline pipeline;
    private final WakeSignal wake;
    private final FileChangeWatcher watcher;
    private final MonitorStateMachine stateMachine;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean summaryPublished = new AtomicBoolean(false);
    private volatile Thread loopThread;
    private Instant lastStatus;

    /**
     * @param watcher optional notification source; {@code null} runs in poll-only mode
     */
    public DefaultMonitorOrchestrator(MonitorProperties props,
                                      LineSource source,
                                      MonitorPipeline pipeline,
                                      WakeSignal wake,
                                      FileChangeWatcher watcher,
                                      MonitorStateMachine stateMachine,
                                      ApplicationEventPublisher publisher,
                                      Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.wake = Objects.requireNonNull(wake, "wake must not be null");
        this.watcher = watcher;
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (watcher != null) {
            watcher.start();
        }
        Thread t = new Thread(this::runLoop, THREAD_NAME);
        loopThread = t;
        t.start();
    }

    @Override
    public void requestStop() {
        wake.cancel();
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread t = loopThread;
        if (t == null) {
            return stateMachine.isStopped();
        }
        t.join(timeout.toMillis());
        return !t.isAlive();
    }

    @Override
    public MonitorState state() {
        return stateMachine.current();
    }

    @Override
    public void stop() {
        requestStop();
        if (loopThread == null) {
            // Never started: still honour the one-summary guarantee.
            drainAndStop();
            return;
        }
        try {
            if (!awaitTermination(SHUTDOWN_TIMEOUT)) {
                LOG.warn("Monitor loop did not stop within {}s", SHUTDOWN_TIMEOUT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the monitor loop to stop");
        }
    }

    @Override
    public boolean isRunning() {
        Thread t = loopThread;
        return t != null && t.isAlive();
    }

    private void runLoop() {
        ThreadContext.put("logFile", source.path().toString());
        try {
            LOG.info("Drift monitor started: file={}, window-size={}, delta={}, threshold={}, poll={}ms{}",
                    source.path(), pipeline.windowCapacity(), props.getDelta(),
                    props.getDelta() * props.getThresholdScale(), props.getPollInterval().toMillis(),
                    watcher == null ? " (poll-only)" : "");
            lastStatus = clock.instant();
            tick();
            while (!wake.isCancelled()) {
                WakeSignal.Reason reason = wake.await(props.getPollInterval());
                if (reason == WakeSignal.Reason.CANCEL) {
                    break;
                }
                LOG.trace("Wake-up: {}", reason);
                tick();
                maybePublishStatus();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Monitor loop interrupted; shutting down");
        } catch (RuntimeException e) {
            LOG.error("Monitor loop failed unexpectedly; shutting down", e);
        } finally {
            drainAndStop();
            ThreadContext.clearAll();
        }
    }

    /**
     * One read cycle: pull appended lines chunk by chunk until the source has no backlog, following
     * the source state and processing every line. A read fault is reported and retried on the next
     * wake-up.
     */
    void tick() {
        do {
            List<String> lines;
            try {
                lines = source.poll();
            } catch (LogSourceException e) {
                publisher.publishEvent(new IngestionFaultEvent(IngestionFaultEvent.Reason.IO_ERROR,
                        source.path(), e.getMessage(), clock.instant()));
                followSourceState();
                return;
            }
            followSourceState();
            for (String line : lines) {
                pipeline.process(line);
            }
        } while (source.hasBacklog() && !wake.isCancelled());
    }

    private void followSourceState() {
        MonitorState current = stateMachine.current();
        if (source.state() == LineSource.SourceState.WAITING) {
            if (current != MonitorState.WAITING && stateMachine.transitionTo(MonitorState.WAITING)) {
                logDiagnostic("Waiting for log file {} to appear (re-checking every {}ms)",
                        source.path(), props.getPollInterval().toMillis());
            }
        } else if (current != MonitorState.ACTIVE && stateMachine.transitionTo(MonitorState.ACTIVE)) {
            LOG.info("Monitoring {}; waiting for predictions...", source.path());
        }
    }

    private void maybePublishStatus() {
        if (props.isQuiet()) {
            return;
        }
        Instant now = clock.instant();
        if (Duration.between(lastStatus, now).compareTo(props.getStatusInterval()) >= 0) {
            lastStatus = now;
            publisher.publishEvent(pipeline.status(now));
        }
    }

    private void drainAndStop() {
        stateMachine.transitionTo(MonitorState.DRAINING);
        if (watcher != null) {
            watcher.close();
        }
        if (summaryPublished.compareAndSet(false, true)) {
            LOG.info("Monitor draining; open window left incomplete at {}", pipeline.windowProgress());
            publisher.publishEvent(pipeline.summary());
        }
        stateMachine.transitionTo(MonitorState.STOPPED);
    }

    private void logDiagnostic(String message, Object... params) {
        if (props.isQuiet()) {
            LOG.debug(message, params);
        } else {
            LOG.info(message, params);
        }
    }
}
