package com.phillippitts.driftwatch.service.decode;

import com.phillippitts.driftwatch.domain.Observation;
import com.phillippitts.driftwatch.util.LogSanitizer;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Decodes JSON-lines prediction records.
 *
 * <p>Accepted shape: {@code {"timestamp": "<RFC3339>", "value": <number>}}. The scalar may also
 * be written as {@code "prediction"} (older producers); {@code "value"} wins when both exist.
 * Extra fields are ignored. A missing or blank timestamp is replaced by the ingestion time.
 *
 * <p>Thread-safe: holds no mutable state.
 *
 * @since 1.0
 */
public final class JsonRecordDecoder implements RecordDecoder {

    static final String VALUE_FIELD = "value";
    static final String LEGACY_VALUE_FIELD = "prediction";
    static final String TIMESTAMP_FIELD = "timestamp";

    private final Clock clock;
    private final int maxPreview;

    public JsonRecordDecoder(Clock clock, int maxPreview) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxPreview <= 0) {
            throw new IllegalArgumentException("maxPreview must be positive, got: " + maxPreview);
        }
        this.maxPreview = maxPreview;
    }

    @Override
    public DecodeResult decode(String line) {
        if (line == null || line.isBlank()) {
            return DecodeResult.blank();
        }
        String trimmed = line.trim();
        JSONObject obj;
        try {
            obj = new JSONObject(trimmed);
        } catch (JSONException e) {
            return fail(trimmed, "malformed JSON: " + e.getMessage());
        }

        String field = obj.has(VALUE_FIELD) ? VALUE_FIELD : LEGACY_VALUE_FIELD;
        Object raw = obj.opt(field);
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return fail(trimmed, "missing required field '" + VALUE_FIELD + "'");
        }
        if (!(raw instanceof Number number)) {
            return fail(trimmed, "field '" + field + "' is not a number");
        }
        double value = number.doubleValue();
        if (!Double.isFinite(value)) {
            return fail(trimmed, "field '" + field + "' is not finite");
        }

        String timestamp = obj.optString(TIMESTAMP_FIELD, "").trim();
        if (timestamp.isEmpty()) {
            timestamp = Instant.now(clock).toString();
        }
        return DecodeResult.of(new Observation(timestamp, value));
    }

    private DecodeResult fail(String line, String reason) {
        return DecodeResult.failed(LogSanitizer.preview(line, maxPreview), reason);
    }
}
