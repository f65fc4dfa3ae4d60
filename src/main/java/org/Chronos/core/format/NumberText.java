package org.Chronos.core.format;

import lombok.experimental.UtilityClass;

import java.math.BigInteger;

/**
 * Number rendering helpers for the writer and digit checks for the reader.
 */
@UtilityClass
class NumberText {

    String zeroPad(long value, int width) {
        return zeroPad(Long.toString(value), width);
    }

    String zeroPad(String digits, int width) {
        if (digits.length() >= width) {
            return digits;
        }
        return "0".repeat(width - digits.length()) + digits;
    }

    /**
     * Renders {@code value} with at most {@code digits} significant digits.
     *
     * <p>Values that fit are written in full; longer values switch to truncated scientific notation
     * such as {@code 1.23E+05}.</p>
     */
    String significant(BigInteger value, int digits, String decimalSeparator) {
        String text = value.toString();
        if (text.length() <= digits) {
            return text;
        }
        StringBuilder builder = new StringBuilder(digits + 8).append(text.charAt(0));
        if (digits > 1) {
            builder.append(decimalSeparator).append(text, 1, digits);
        }
        return builder.append("E+").append(zeroPad(text.length() - 1L, 2)).toString();
    }

    boolean isDigits(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }
}
