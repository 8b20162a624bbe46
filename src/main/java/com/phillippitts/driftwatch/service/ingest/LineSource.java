package com.phillippitts.driftwatch.service.ingest;

import com.phillippitts.driftwatch.exception.LogSourceException;

import java.nio.file.Path;
import java.util.List;

/**
 * Delivers the complete lines appended to a growing file since the last call.
 *
 * <p>Lines are returned in file order and never re-delivered. A trailing line without a
 * terminator is held back until its newline arrives. The file does not need to exist yet;
 * while it is missing the source reports {@link SourceState#WAITING} and returns no lines.
 */
public interface LineSource {

    enum SourceState { WAITING, OPEN }

    /**
     * Reads everything appended since the previous call.
     *
     * @return newly completed lines (possibly empty), without terminators
     * @throws LogSourceException if the file exists but cannot be read; the cursor is left
     *         where it was so the next call retries
     */
    List<String> poll();

    SourceState state();

    Path path();

    /** Bytes consumed from the current file so far. */
    long offset();

    /** Whether the last poll left appended bytes unread; poll again before waiting. */
    boolean hasBacklog();
}
