package uk.gegc.mathassessment.features.ai.api.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one text-generator call: either a loosely-typed field bag parsed from the
 * reply, or a failure with its reason. Consumed once by the response validator.
 *
 * @param ok     whether structured data was obtained
 * @param data   parsed fields, never trusted for types; {@code null} on failure
 * @param error  human-readable failure message; {@code null} on success
 * @param reason failure category; {@code null} on success
 */
public record GenerationOutcome(boolean ok, Map<String, Object> data, String error, FailureReason reason) {

    public GenerationOutcome {
        if (ok && data == null) {
            throw new IllegalArgumentException("Successful outcome requires data");
        }
        if (!ok && reason == null) {
            throw new IllegalArgumentException("Failed outcome requires a reason");
        }
        if (data != null) {
            data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        }
    }

    public static GenerationOutcome success(Map<String, Object> data) {
        return new GenerationOutcome(true, data, null, null);
    }

    public static GenerationOutcome failure(FailureReason reason, String error) {
        return new GenerationOutcome(false, null, error, reason);
    }

    public boolean hasData() {
        return ok && !data.isEmpty();
    }

    public enum FailureReason {
        /** Backend missing or not runnable */
        BACKEND_UNAVAILABLE,
        /** Backend ran and errored */
        BACKEND_FAILURE,
        /** Reply contained no parseable JSON object */
        MALFORMED_RESPONSE
    }
}
