package org.Chronos.core.duration;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Raised when an aeon or Planck-time magnitude would need more than
 * {@link DurationUnits#MAX_MAGNITUDE_DIGITS} decimal digits.
 */
@Getter
@Accessors(fluent = true)
public final class DurationOverflowException extends ArithmeticException {
    public static final String REASON_MAGNITUDE_OVERFLOW = "MAGNITUDE_OVERFLOW";

    private final String reasonCode;

    /**
     * Creates a reason-coded overflow failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public DurationOverflowException(String reasonCode, String message) {
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
