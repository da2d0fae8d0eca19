package com.bbthechange.mobilelogin.validation;

import java.util.Map;

/**
 * Structured reason an inbound payload was rejected, mirrored onto the
 * {@code connection_error} event.
 *
 * @param code stable machine-readable code, e.g. {@code MISSING_FIELD}
 * @param errorType category of the code, e.g. {@code FIELD_ERROR}
 * @param field JSON name of the offending field, or {@code root}
 * @param message human-readable explanation
 * @param details rule parameters such as expected lengths
 */
public record ValidationFailure(String code, String errorType, String field, String message,
                                Map<String, Object> details) {

    public static final String INVALID_FORMAT = "INVALID_FORMAT";
    public static final String INVALID_TYPE = "INVALID_TYPE";
    public static final String MISSING_FIELD = "MISSING_FIELD";
    public static final String EMPTY_FIELD = "EMPTY_FIELD";
    public static final String INVALID_LENGTH = "INVALID_LENGTH";
    public static final String INVALID_REFERRAL = "INVALID_REFERRAL";

    public static final String FORMAT_ERROR = "FORMAT_ERROR";
    public static final String TYPE_ERROR = "TYPE_ERROR";
    public static final String FIELD_ERROR = "FIELD_ERROR";
    public static final String VALUE_ERROR = "VALUE_ERROR";
    public static final String LENGTH_ERROR = "LENGTH_ERROR";

    public static ValidationFailure notAnObject(String eventName, String receivedType) {
        return new ValidationFailure(INVALID_FORMAT, FORMAT_ERROR, "root",
                eventName + " data must be a JSON object", Map.of("received_type", receivedType));
    }

    public static ValidationFailure wrongType(String field, String expectedType, String receivedType, boolean required) {
        return new ValidationFailure(INVALID_TYPE, TYPE_ERROR, field,
                field + " must be a " + expectedType,
                Map.of("expected_type", expectedType, "received_type", receivedType, "required", required));
    }
}
