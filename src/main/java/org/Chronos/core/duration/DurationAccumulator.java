package org.Chronos.core.duration;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Objects;

/**
 * Mutable, single-use collector that folds unit amounts into the five radix fields and
 * normalizes them into a canonical {@link Duration}.
 *
 * <p>Amounts may be out of range or fractional. Integer parts land in the unit's field;
 * fractional parts cascade into finer fields until Planck time, where any remainder is
 * truncated. {@link #toDuration()} then carries overflow bottom-up
 * (Planck time to yoctoseconds to nanoseconds to years to aeons).</p>
 *
 * <p>Not thread-safe; create one per construction.</p>
 */
public final class DurationAccumulator {

    private static final int MAX_INPUT_EXPONENT = DurationUnits.MAX_MAGNITUDE_DIGITS + 64;

    private final BigInteger[] fields = new BigInteger[RadixField.values().length];
    private boolean negative;

    /**
     * Creates an empty accumulator.
     */
    public DurationAccumulator() {
        Arrays.fill(fields, BigInteger.ZERO);
    }

    /**
     * Sets the sign of the resulting duration.
     *
     * @param negative whether the result is negative.
     * @return this accumulator.
     */
    public DurationAccumulator negative(boolean negative) {
        this.negative = negative;
        return this;
    }

    /**
     * Adds a whole amount of {@code unit}.
     *
     * @param unit unit of the amount.
     * @param amount non-negative amount.
     * @return this accumulator.
     */
    public DurationAccumulator add(DurationUnit unit, long amount) {
        return add(unit, BigInteger.valueOf(amount));
    }

    /**
     * Adds a whole amount of {@code unit}.
     *
     * @param unit unit of the amount.
     * @param amount non-negative amount.
     * @return this accumulator.
     */
    public DurationAccumulator add(DurationUnit unit, BigInteger amount) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(unit + " amount must be >= 0, got " + amount);
        }
        int index = unit.field().ordinal();
        fields[index] = fields[index].add(amount.multiply(unit.unitsInField()));
        return this;
    }

    /**
     * Adds a possibly fractional amount of {@code unit}.
     *
     * @param unit unit of the amount.
     * @param amount non-negative amount.
     * @return this accumulator.
     */
    public DurationAccumulator add(DurationUnit unit, BigDecimal amount) {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(unit + " amount must be >= 0, got " + amount);
        }
        if (amount.signum() == 0) {
            return this;
        }
        // Reject absurd exponents before BigDecimal expands them into digits.
        if (amount.precision() - amount.scale() > MAX_INPUT_EXPONENT) {
            throw overflow(unit + " amount " + amount.round(new MathContext(8)));
        }

        RadixField field = unit.field();
        BigDecimal value = amount.multiply(unit.unitsInFieldDecimal());
        while (field != null && value.signum() > 0) {
            BigDecimal whole = value.setScale(0, RoundingMode.DOWN);
            int index = field.ordinal();
            fields[index] = fields[index].add(whole.toBigIntegerExact());
            BigDecimal fraction = value.subtract(whole);
            if (fraction.signum() == 0 || field.subdivisions() == null) {
                break;
            }
            value = fraction.multiply(new BigDecimal(field.subdivisions()));
            field = field.finer();
        }
        return this;
    }

    /**
     * Carries every field into range and builds the canonical duration.
     *
     * @return normalized duration; {@link Duration#ZERO} when nothing was added.
     * @throws DurationOverflowException when the aeon count exceeds the digit limit.
     */
    public Duration toDuration() {
        BigInteger[] carried = fields.clone();
        RadixField[] chain = RadixField.values();
        for (int i = chain.length - 1; i > 0; i--) {
            BigInteger[] qr = carried[i].divideAndRemainder(chain[i - 1].subdivisions());
            carried[i] = qr[1];
            carried[i - 1] = carried[i - 1].add(qr[0]);
        }
        BigInteger aeons = carried[RadixField.AEONS.ordinal()];
        checkDigits(aeons, "aeons");
        return Duration.fromCanonicalFields(
                negative,
                false,
                carried[RadixField.PLANCK_TIME.ordinal()],
                carried[RadixField.YOCTOSECONDS.ordinal()].longValueExact(),
                carried[RadixField.NANOSECONDS.ordinal()].longValueExact(),
                carried[RadixField.YEARS.ordinal()].intValueExact(),
                aeons
        );
    }

    /**
     * Fails when {@code magnitude} has more decimal digits than the configured limit.
     *
     * @param magnitude value to check, may be {@code null}.
     * @param name field name used in the message.
     */
    static void checkDigits(BigInteger magnitude, String name) {
        if (magnitude == null || magnitude.signum() == 0) {
            return;
        }
        // bitLength * log10(2) bounds the digit count without rendering the number.
        if ((long) (magnitude.bitLength() * 0.30103) + 1 > DurationUnits.MAX_MAGNITUDE_DIGITS
                && magnitude.toString().length() > DurationUnits.MAX_MAGNITUDE_DIGITS) {
            throw overflow(name + " exceed " + DurationUnits.MAX_MAGNITUDE_DIGITS + " digits");
        }
    }

    private static DurationOverflowException overflow(String detail) {
        return new DurationOverflowException(
                DurationOverflowException.REASON_MAGNITUDE_OVERFLOW,
                "duration magnitude out of range: " + detail
        );
    }
}
