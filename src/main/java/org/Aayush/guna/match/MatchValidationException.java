package org.Aayush.guna.match;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Caller input defect with a deterministic reason code and the offending field.
 *
 * <p>Raised before any scoring work so no partial result is ever returned.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MatchValidationException extends RuntimeException {
    public static final String REASON_PERSON_REQUIRED = "GM_PERSON_REQUIRED";
    public static final String REASON_FIELD_REQUIRED = "GM_FIELD_REQUIRED";
    public static final String REASON_FIELD_OUT_OF_DOMAIN = "GM_FIELD_OUT_OF_DOMAIN";
    public static final String REASON_CANDIDATES_REQUIRED = "GM_CANDIDATES_REQUIRED";
    public static final String REASON_CANDIDATE_ID_REQUIRED = "GM_CANDIDATE_ID_REQUIRED";
    public static final String REASON_DUPLICATE_CANDIDATE_ID = "GM_DUPLICATE_CANDIDATE_ID";
    public static final String REASON_CANDIDATE_LIMIT_EXCEEDED = "GM_CANDIDATE_LIMIT_EXCEEDED";
    public static final String REASON_BATCH_CONFIG_INVALID = "GM_BATCH_CONFIG_INVALID";

    private final String reasonCode;
    private final String field;

    /**
     * Creates a reason-coded validation failure.
     *
     * @param reasonCode deterministic reason code.
     * @param field offending input field, e.g. {@code person_a.moon_rashi}.
     * @param message descriptive message.
     */
    public MatchValidationException(String reasonCode, String field, String message) {
        super(formatMessage(reasonCode, field, message));
        this.reasonCode = requireReasonCode(reasonCode);
        this.field = Objects.requireNonNull(field, "field");
    }

    /**
     * Creates a reason-coded validation failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param field offending input field.
     * @param message descriptive message.
     * @param cause underlying cause.
     */
    public MatchValidationException(String reasonCode, String field, String message, Throwable cause) {
        super(formatMessage(reasonCode, field, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
        this.field = Objects.requireNonNull(field, "field");
    }

    private static String formatMessage(String reasonCode, String field, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(field, "field")
                + ": " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
