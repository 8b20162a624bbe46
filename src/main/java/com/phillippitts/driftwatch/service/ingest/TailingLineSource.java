package com.phillippitts.driftwatch.service.ingest;

import com.phillippitts.driftwatch.exception.LogSourceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link LineSource} that tails a file by byte offset, in the manner of {@code tail -F}.
 *
 * <p>Cursor rules:
 * <ul>
 *   <li>File present on the first poll: start at end-of-file, or at byte 0 when
 *       {@code fromBeginning} is set.</li>
 *   <li>File appearing later (created, or re-created after vanishing): start at byte 0.</li>
 *   <li>File shorter than the cursor (truncation) or with a different file key (rotation):
 *       restart at byte 0 and drop any held partial line.</li>
 * </ul>
 *
 * <p>Each poll reads at most one chunk and moves the cursor only after that read succeeded, so a
 * failed read is retried from the same offset. {@link #hasBacklog()} tells the caller to poll
 * again. A line longer than the line limit is dropped up to its terminator.
 *
 * <p>The file is only ever opened for reading. Not thread-safe: confined to the monitor
 * control thread.
 */
public class TailingLineSource implements LineSource {

    private static final Logger LOG = LogManager.getLogger(TailingLineSource.class);

    /** Upper bound for a single poll; larger backlogs are read over several polls. */
    static final int READ_CHUNK_BYTES = 1 << 20;

    /** Longest line held back while waiting for its terminator. */
    static final int MAX_LINE_BYTES = 4 << 20;

    /** Reads from the channel at an absolute position; a seam for read failures in tests. */
    @FunctionalInterface
    interface ChunkReader {
        int read(FileChannel channel, ByteBuffer buffer, long position) throws IOException;
    }

    private final Path path;
    private final boolean fromBeginning;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final int chunkBytes;
    private final int maxLineBytes;
    private final ChunkReader reader;

    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
    private SourceState state = SourceState.WAITING;
    private boolean firstCheck = true;
    private boolean waitingReported = false;
    private long offset = 0;
    private Object fileKey;
    private boolean backlog = false;
    private boolean droppingLongLine = false;

    public TailingLineSource(Path path, boolean fromBeginning, ApplicationEventPublisher publisher, Clock clock) {
        this(path, fromBeginning, publisher, clock, READ_CHUNK_BYTES, MAX_LINE_BYTES, FileChannel::read);
    }

    TailingLineSource(Path path, boolean fromBeginning, ApplicationEventPublisher publisher, Clock clock,
                      int chunkBytes, int maxLineBytes, ChunkReader reader) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.fromBeginning = fromBeginning;
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (chunkBytes <= 0 || maxLineBytes <= 0) {
            throw new IllegalArgumentException("chunkBytes and maxLineBytes must be positive");
        }
        this.chunkBytes = chunkBytes;
        this.maxLineBytes = maxLineBytes;
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    @Override
    public List<String> poll() {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            onMissing();
            return List.of();
        } catch (IOException e) {
            backlog = false;
            throw new LogSourceException(path, e.toString(), e);
        }
        if (!attrs.isRegularFile()) {
            // Whatever replaces it later is a new file, read from byte 0.
            firstCheck = false;
            backlog = false;
            throw new LogSourceException(path, "not a regular file", null);
        }

        if (state == SourceState.WAITING) {
            open(attrs);
        } else {
            checkReplaced(attrs);
        }
        return readAppended();
    }

    @Override
    public SourceState state() {
        return state;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public long offset() {
        return offset;
    }

    @Override
    public boolean hasBacklog() {
        return backlog;
    }

    private void onMissing() {
        backlog = false;
        if (state == SourceState.OPEN) {
            LOG.warn("Log file {} disappeared at offset {}; waiting for it to reappear", path, offset);
            publish(IngestionFaultEvent.Reason.VANISHED, "offset=" + offset);
            state = SourceState.WAITING;
            resetCursor();
            waitingReported = true;
        } else if (!waitingReported) {
            publish(IngestionFaultEvent.Reason.WAITING_FOR_FILE, "");
            waitingReported = true;
        }
        firstCheck = false;
    }

    private void open(BasicFileAttributes attrs) {
        boolean tail = firstCheck && !fromBeginning;
        offset = tail ? attrs.size() : 0L;
        fileKey = attrs.fileKey();
        partial.reset();
        state = SourceState.OPEN;
        firstCheck = false;
        waitingReported = false;
        LOG.info("Opened log file {} at offset {} ({})", path, offset, tail ? "tailing new lines" : "reading from start");
    }

    private void checkReplaced(BasicFileAttributes attrs) {
        Object key = attrs.fileKey();
        if (fileKey != null && key != null && !fileKey.equals(key)) {
            LOG.warn("Log file {} was rotated; resetting offset {} to 0", path, offset);
            publish(IngestionFaultEvent.Reason.ROTATED, "offset=" + offset);
            fileKey = key;
            resetCursor();
        } else if (attrs.size() < offset) {
            LOG.warn("Log file {} shrank to {} bytes below offset {}; resetting to 0", path, attrs.size(), offset);
            publish(IngestionFaultEvent.Reason.TRUNCATED, "size=" + attrs.size() + ", offset=" + offset);
            resetCursor();
        }
    }

    private List<String> readAppended() {
        List<String> lines = new ArrayList<>();
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size < offset) {
                // Shrank between the attribute check and the open.
                publish(IngestionFaultEvent.Reason.TRUNCATED, "size=" + size + ", offset=" + offset);
                resetCursor();
            }
            int length = (int) Math.min(size - offset, chunkBytes);
            if (length > 0) {
                ByteBuffer buffer = ByteBuffer.allocate(length);
                int read = reader.read(channel, buffer, offset);
                if (read > 0) {
                    offset += read;
                    split(buffer.array(), read, lines);
                }
            }
            backlog = offset < size;
        } catch (NoSuchFileException e) {
            onMissing();
            return lines;
        } catch (IOException e) {
            backlog = false;
            throw new LogSourceException(path, e.toString(), e);
        }
        if (!lines.isEmpty()) {
            LOG.debug("Read {} line(s) from {}; offset now {}", lines.size(), path, offset);
        }
        return lines;
    }

    private void split(byte[] bytes, int length, List<String> out) {
        int start = 0;
        for (int i = 0; i < length; i++) {
            if (bytes[i] == '\n') {
                if (droppingLongLine || partial.size() + (i - start) > maxLineBytes) {
                    if (!droppingLongLine) {
                        dropLongLine(partial.size() + (i - start));
                    }
                    droppingLongLine = false;
                } else {
                    partial.write(bytes, start, i - start);
                    out.add(stripCarriageReturn(partial.toString(StandardCharsets.UTF_8)));
                }
                partial.reset();
                start = i + 1;
            }
        }
        if (droppingLongLine) {
            return;
        }
        partial.write(bytes, start, length - start);
        if (partial.size() > maxLineBytes) {
            dropLongLine(partial.size());
            partial.reset();
            droppingLongLine = true;
        }
    }

    private void dropLongLine(long bytesSoFar) {
        LOG.warn("Dropping a line of {}+ bytes in {} (limit {})", bytesSoFar, path, maxLineBytes);
        publish(IngestionFaultEvent.Reason.LINE_TOO_LONG, "bytes=" + bytesSoFar + ", limit=" + maxLineBytes);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private void resetCursor() {
        offset = 0L;
        partial.reset();
        droppingLongLine = false;
    }

    private void publish(IngestionFaultEvent.Reason reason, String detail) {
        publisher.publishEvent(new IngestionFaultEvent(reason, path, detail, clock.instant()));
    }
}
