package org.Chronos.core.format;

import lombok.experimental.UtilityClass;
import org.Chronos.core.duration.Duration;
import org.Chronos.core.duration.DurationAccumulator;
import org.Chronos.core.duration.DurationUnit;
import org.Chronos.core.duration.DurationUnits;

import java.math.BigInteger;

/**
 * Decimal digits of the sub-second part, shared by the {@code F} writer and reader.
 *
 * <p>Digit layout: 9 digits of nanoseconds within the second, 15 digits of yoctoseconds, then the
 * Planck-time fraction of a yoctosecond. Output is truncated, never rounded.</p>
 */
@UtilityClass
class FractionalSeconds {

    private static final int NANOSECOND_DIGITS = 9;
    private static final int YOCTOSECOND_DIGITS = 15;
    private static final int FIXED_DIGITS = NANOSECOND_DIGITS + YOCTOSECOND_DIGITS;

    String digits(Duration value, int count) {
        StringBuilder builder = new StringBuilder(Math.max(count, FIXED_DIGITS));
        builder.append(NumberText.zeroPad(value.getTotalNanoseconds() % DurationUnits.NANOSECONDS_PER_SECOND, NANOSECOND_DIGITS));
        builder.append(NumberText.zeroPad(value.getTotalYoctoseconds(), YOCTOSECOND_DIGITS));
        if (count > FIXED_DIGITS) {
            int planckDigits = count - FIXED_DIGITS;
            BigInteger planck = value.getPlanckTime() == null ? BigInteger.ZERO : value.getPlanckTime();
            BigInteger fraction = planck.multiply(BigInteger.TEN.pow(planckDigits))
                    .divide(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND);
            builder.append(NumberText.zeroPad(fraction.toString(), planckDigits));
        }
        return builder.substring(0, count);
    }

    /**
     * Adds the sub-second value written as {@code digits} to the accumulator.
     *
     * @param digits plain decimal digits, most significant first.
     * @param accumulator target accumulator.
     */
    void fold(String digits, DurationAccumulator accumulator) {
        int length = digits.length();
        String nanoseconds = digits.substring(0, Math.min(NANOSECOND_DIGITS, length));
        accumulator.add(DurationUnit.NANOSECOND, Long.parseLong(padRight(nanoseconds, NANOSECOND_DIGITS)));
        if (length > NANOSECOND_DIGITS) {
            String yoctoseconds = digits.substring(NANOSECOND_DIGITS, Math.min(FIXED_DIGITS, length));
            accumulator.add(DurationUnit.YOCTOSECOND, Long.parseLong(padRight(yoctoseconds, YOCTOSECOND_DIGITS)));
        }
        if (length > FIXED_DIGITS) {
            String rest = digits.substring(FIXED_DIGITS);
            BigInteger planck = new BigInteger(rest)
                    .multiply(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND)
                    .divide(BigInteger.TEN.pow(rest.length()));
            accumulator.add(DurationUnit.PLANCK_TIME, planck);
        }
    }

    private String padRight(String digits, int width) {
        StringBuilder builder = new StringBuilder(width).append(digits);
        while (builder.length() < width) {
            builder.append('0');
        }
        return builder.toString();
    }
}
