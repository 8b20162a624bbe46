package com.phillippitts.driftwatch.service.decode;

/**
 * Why a line was rejected.
 *
 * @param linePreview the offending line, truncated and stripped of control characters
 * @param reason short human-readable reason
 */
public record DecodeError(String linePreview, String reason) {
}
