package org.Chronos.core.duration;

import lombok.experimental.UtilityClass;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Carry and borrow arithmetic over the five radix fields.
 *
 * <p>Every operand is canonical, so one carry (or borrow) per field is always enough.</p>
 */
@UtilityClass
class ExactArithmetic {

    Duration negate(Duration value) {
        if (value.isPerpetual()) {
            return Duration.perpetual(!value.isNegative());
        }
        if (value.isZero()) {
            return Duration.ZERO;
        }
        return Duration.fromCanonicalFields(
                !value.isNegative(),
                false,
                value.getPlanckTime(),
                value.getTotalYoctoseconds(),
                value.getTotalNanoseconds(),
                value.getYears(),
                value.getAeons()
        );
    }

    Duration add(Duration a, Duration b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.isPerpetual() || b.isPerpetual()) {
            if (a.isPerpetual() && b.isPerpetual()) {
                // Opposite infinities cancel.
                return a.isNegative() == b.isNegative() ? a : Duration.ZERO;
            }
            return a.isPerpetual() ? a : b;
        }
        if (a.isZero()) {
            return b;
        }
        if (b.isZero()) {
            return a;
        }
        if (a.isNegative() != b.isNegative()) {
            return subtract(a, negate(b));
        }
        return addMagnitudes(a, b, a.isNegative());
    }

    Duration subtract(Duration a, Duration b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.isPerpetual() && b.isPerpetual()) {
            return a.isNegative() == b.isNegative() ? Duration.ZERO : a;
        }
        if (a.isPerpetual()) {
            return a;
        }
        if (b.isPerpetual()) {
            return Duration.perpetual(!b.isNegative());
        }
        if (b.isZero()) {
            return a;
        }
        if (a.isZero()) {
            return negate(b);
        }
        if (a.isNegative() && b.isNegative()) {
            // -|a| - -|b| = |b| - |a|
            return subtract(negate(b), negate(a));
        }
        if (b.isNegative()) {
            return addMagnitudes(a, b, false);
        }
        if (a.isNegative()) {
            return addMagnitudes(a, b, true);
        }
        int magnitude = compareMagnitudes(a, b);
        if (magnitude == 0) {
            return Duration.ZERO;
        }
        if (magnitude < 0) {
            return negate(subtractMagnitudes(b, a));
        }
        return subtractMagnitudes(a, b);
    }

    int compare(Duration a, Duration b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        int signA = a.sign();
        int signB = b.sign();
        if (signA != signB) {
            return Integer.compare(signA, signB);
        }
        if (signA == 0) {
            return 0;
        }
        if (a.isPerpetual() || b.isPerpetual()) {
            if (a.isPerpetual() && b.isPerpetual()) {
                return 0;
            }
            return a.isPerpetual() ? signA : -signA;
        }
        return compareMagnitudes(a, b) * signA;
    }

    /**
     * Lexicographic comparison of the magnitude fields, most significant first.
     */
    int compareMagnitudes(Duration a, Duration b) {
        int result = a.aeonsOrZero().compareTo(b.aeonsOrZero());
        if (result != 0) {
            return result;
        }
        result = Integer.compare(a.getYears(), b.getYears());
        if (result != 0) {
            return result;
        }
        result = Long.compare(a.getTotalNanoseconds(), b.getTotalNanoseconds());
        if (result != 0) {
            return result;
        }
        result = Long.compare(a.getTotalYoctoseconds(), b.getTotalYoctoseconds());
        if (result != 0) {
            return result;
        }
        return a.planckTimeOrZero().compareTo(b.planckTimeOrZero());
    }

    private Duration addMagnitudes(Duration a, Duration b, boolean negative) {
        BigInteger planck = a.planckTimeOrZero().add(b.planckTimeOrZero());
        long carry = 0L;
        if (planck.compareTo(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND) >= 0) {
            planck = planck.subtract(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND);
            carry = 1L;
        }

        long yoctoseconds = a.getTotalYoctoseconds() + b.getTotalYoctoseconds() + carry;
        carry = 0L;
        if (yoctoseconds >= DurationUnits.YOCTOSECONDS_PER_NANOSECOND) {
            yoctoseconds -= DurationUnits.YOCTOSECONDS_PER_NANOSECOND;
            carry = 1L;
        }

        long nanoseconds = a.getTotalNanoseconds() + b.getTotalNanoseconds() + carry;
        carry = 0L;
        if (nanoseconds >= DurationUnits.NANOSECONDS_PER_YEAR) {
            nanoseconds -= DurationUnits.NANOSECONDS_PER_YEAR;
            carry = 1L;
        }

        long years = (long) a.getYears() + b.getYears() + carry;
        carry = 0L;
        if (years >= DurationUnits.YEARS_PER_AEON) {
            years -= DurationUnits.YEARS_PER_AEON;
            carry = 1L;
        }

        BigInteger aeons = a.aeonsOrZero().add(b.aeonsOrZero()).add(BigInteger.valueOf(carry));
        DurationAccumulator.checkDigits(aeons, "aeons");
        return Duration.fromCanonicalFields(negative, false, planck, yoctoseconds, nanoseconds, (int) years, aeons);
    }

    /**
     * Computes {@code |a| - |b|} for {@code |a| > |b|}, borrowing from the next coarser field
     * whenever a field difference goes negative.
     */
    private Duration subtractMagnitudes(Duration a, Duration b) {
        BigInteger planck = a.planckTimeOrZero().subtract(b.planckTimeOrZero());
        long borrow = 0L;
        if (planck.signum() < 0) {
            planck = planck.add(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND);
            borrow = 1L;
        }

        long yoctoseconds = a.getTotalYoctoseconds() - b.getTotalYoctoseconds() - borrow;
        borrow = 0L;
        if (yoctoseconds < 0L) {
            yoctoseconds += DurationUnits.YOCTOSECONDS_PER_NANOSECOND;
            borrow = 1L;
        }

        long nanoseconds = a.getTotalNanoseconds() - b.getTotalNanoseconds() - borrow;
        borrow = 0L;
        if (nanoseconds < 0L) {
            nanoseconds += DurationUnits.NANOSECONDS_PER_YEAR;
            borrow = 1L;
        }

        long years = (long) a.getYears() - b.getYears() - borrow;
        borrow = 0L;
        if (years < 0L) {
            years += DurationUnits.YEARS_PER_AEON;
            borrow = 1L;
        }

        BigInteger aeons = a.aeonsOrZero().subtract(b.aeonsOrZero()).subtract(BigInteger.valueOf(borrow));
        return Duration.fromCanonicalFields(false, false, planck, yoctoseconds, nanoseconds, (int) years, aeons);
    }
}
