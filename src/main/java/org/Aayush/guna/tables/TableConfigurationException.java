package org.Aayush.guna.tables;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a frozen lookup table violates its shape or value contract.
 *
 * <p>Raised only while tables are verified during class initialization. It marks a
 * build defect and is never an expected caller-facing condition.</p>
 */
@Getter
@Accessors(fluent = true)
public final class TableConfigurationException extends RuntimeException {
    public static final String REASON_TABLE_INCOMPLETE = "GT_TABLE_INCOMPLETE";
    public static final String REASON_TABLE_ASYMMETRIC = "GT_TABLE_ASYMMETRIC";
    public static final String REASON_TABLE_VALUE_OUT_OF_RANGE = "GT_TABLE_VALUE_OUT_OF_RANGE";

    private final String reasonCode;

    /**
     * Creates a reason-coded table failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public TableConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
