package com.phillippitts.driftwatch.service.decode;

/**
 * Turns one raw log line into an observation. Implementations never throw for bad input;
 * they return {@link DecodeResult#failed} so the caller can count the line and move on.
 */
public interface RecordDecoder {

    /**
     * Decodes a single line.
     *
     * @param line raw line without its terminator; may be {@code null} or blank
     * @return a decoded observation, a blank marker, or a decode error
     */
    DecodeResult decode(String line);
}
