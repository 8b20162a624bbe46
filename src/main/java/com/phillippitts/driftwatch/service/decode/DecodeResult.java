package com.phillippitts.driftwatch.service.decode;

import com.phillippitts.driftwatch.domain.Observation;

import java.util.Objects;

/**
 * Result of decoding one line: exactly one of observation, blank, or error.
 */
public record DecodeResult(Kind kind, Observation observation, DecodeError error) {

    public enum Kind { OBSERVATION, BLANK, ERROR }

    private static final DecodeResult BLANK = new DecodeResult(Kind.BLANK, null, null);

    public DecodeResult {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.OBSERVATION && observation == null) {
            throw new IllegalArgumentException("observation required for kind OBSERVATION");
        }
        if (kind == Kind.ERROR && error == null) {
            throw new IllegalArgumentException("error required for kind ERROR");
        }
    }

    public static DecodeResult of(Observation observation) {
        return new DecodeResult(Kind.OBSERVATION, observation, null);
    }

    public static DecodeResult blank() {
        return BLANK;
    }

    public static DecodeResult failed(String linePreview, String reason) {
        return new DecodeResult(Kind.ERROR, null, new DecodeError(linePreview, reason));
    }

    public boolean isObservation() {
        return kind == Kind.OBSERVATION;
    }

    public boolean isBlank() {
        return kind == Kind.BLANK;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }
}
