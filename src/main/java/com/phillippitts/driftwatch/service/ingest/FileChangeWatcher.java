package com.phillippitts.driftwatch.service.ingest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Best-effort OS notification source: watches the log file's directory with the JDK
 * {@link WatchService} on a daemon thread and turns events for the file into
 * {@link WakeSignal#fileChanged()} calls.
 *
 * <p>Delivery is not guaranteed on every platform or file system (some back ends poll, some
 * coalesce rapid appends), so the monitor never relies on it alone. The thread touches nothing
 * but the wake signal. If the directory does not exist yet it is re-checked every
 * {@code retryInterval}.
 */
public class FileChangeWatcher implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(FileChangeWatcher.class);

    private static final long JOIN_TIMEOUT_MS = 2_000;

    private final Path file;
    private final WakeSignal wake;
    private final Duration retryInterval;

    private volatile boolean running = false;
    private Thread thread;

    public FileChangeWatcher(Path file, WakeSignal wake, Duration retryInterval) {
        this.file = Objects.requireNonNull(file, "file must not be null").toAbsolutePath();
        this.wake = Objects.requireNonNull(wake, "wake must not be null");
        this.retryInterval = Objects.requireNonNull(retryInterval, "retryInterval must not be null");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::watchLoop, "drift-file-watch");
        thread.setDaemon(true);
        thread.start();
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        Thread t;
        synchronized (this) {
            running = false;
            t = thread;
            thread = null;
        }
        if (t != null) {
            t.interrupt();
            try {
                t.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void watchLoop() {
        Path dir = file.getParent();
        try {
            while (running) {
                if (dir == null || !Files.isDirectory(dir)) {
                    TimeUnit.MILLISECONDS.sleep(retryInterval.toMillis());
                    continue;
                }
                watchDirectory(dir);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            LOG.debug("Watch service closed for {}", dir);
        }
        LOG.debug("File watcher for {} stopped", file);
    }

    private void watchDirectory(Path dir) throws InterruptedException {
        try (WatchService service = dir.getFileSystem().newWatchService()) {
            dir.register(service,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
            LOG.debug("Watching {} for changes to {}", dir, file.getFileName());
            while (running) {
                WatchKey key = service.poll(retryInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW
                            || file.getFileName().equals(event.context())) {
                        wake.fileChanged();
                    }
                }
                if (!key.reset()) {
                    LOG.debug("Watch key for {} is no longer valid", dir);
                    return;
                }
            }
        } catch (IOException e) {
            LOG.warn("Cannot watch {} ({}); relying on polling", dir, e.toString());
            TimeUnit.MILLISECONDS.sleep(retryInterval.toMillis());
        }
    }
}
