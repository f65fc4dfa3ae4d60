package org.Chronos.core.format;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded failure raised when text does not match a duration pattern.
 */
@Getter
@Accessors(fluent = true)
public final class DurationFormatException extends IllegalArgumentException {
    public static final String REASON_EMPTY_INPUT = "EMPTY_INPUT";
    public static final String REASON_PATTERN_MISMATCH = "PATTERN_MISMATCH";
    public static final String REASON_UNKNOWN_UNIT_SYMBOL = "UNKNOWN_UNIT_SYMBOL";
    public static final String REASON_MALFORMED_NUMBER = "MALFORMED_NUMBER";

    private final String reasonCode;

    /**
     * Creates a reason-coded format failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public DurationFormatException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded format failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public DurationFormatException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
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
