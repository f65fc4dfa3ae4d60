package org.Chronos.core.duration;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Scalar multiplication and division, duration ratios and remainders.
 *
 * <p>Scaling applies the factor to every magnitude field independently and folds the products back
 * through a {@link DurationAccumulator}, so fractional aeons spill into years, fractional years into
 * nanoseconds and so on down to Planck time.</p>
 */
@Slf4j
@UtilityClass
class ScaledArithmetic {

    /** Digits kept below the aeon unit when dividing; covers the whole chain down to Planck time. */
    private static final int DIVISION_GUARD_DIGITS = 72;

    /** Units tried by {@link #ratio}, finest first. */
    private static final DurationUnit[] RATIO_UNITS = {
            DurationUnit.PLANCK_TIME,
            DurationUnit.YOCTOSECOND,
            DurationUnit.NANOSECOND,
            DurationUnit.SECOND,
            DurationUnit.YEAR,
            DurationUnit.AEON
    };

    Duration multiply(Duration value, BigDecimal factor) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(factor, "factor");
        if (factor.signum() == 0) {
            return Duration.ZERO;
        }
        boolean negative = value.isNegative() != (factor.signum() < 0);
        if (value.isPerpetual()) {
            return Duration.perpetual(negative);
        }
        if (value.isZero()) {
            return Duration.ZERO;
        }
        BigDecimal magnitude = factor.abs();
        return scale(value, field -> field.multiply(magnitude), negative);
    }

    Duration multiply(Duration value, double factor) {
        Objects.requireNonNull(value, "value");
        if (Double.isNaN(factor)) {
            throw new IllegalArgumentException("factor must not be NaN");
        }
        // A zero receiver counts as positive.
        if (Double.isInfinite(factor)) {
            return Duration.perpetual(value.isNegative() != (factor < 0));
        }
        return multiply(value, BigDecimal.valueOf(factor));
    }

    Duration divide(Duration value, BigDecimal divisor) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(divisor, "divisor");
        if (value.isZero()) {
            return Duration.ZERO;
        }
        if (divisor.signum() == 0) {
            return Duration.perpetual(value.isNegative());
        }
        boolean negative = value.isNegative() != (divisor.signum() < 0);
        if (value.isPerpetual()) {
            return Duration.perpetual(negative);
        }
        BigDecimal magnitude = divisor.abs();
        MathContext context = divisionContext(value, magnitude);
        return scale(value, field -> field.divide(magnitude, context), negative);
    }

    Duration divide(Duration value, double divisor) {
        Objects.requireNonNull(value, "value");
        if (Double.isNaN(divisor)) {
            throw new IllegalArgumentException("divisor must not be NaN");
        }
        if (value.isZero()) {
            return Duration.ZERO;
        }
        if (divisor == 0.0) {
            return Duration.perpetual(value.isNegative());
        }
        if (value.isPerpetual()) {
            return Duration.perpetual(value.isNegative() != (divisor < 0));
        }
        if (Double.isInfinite(divisor)) {
            return Duration.ZERO;
        }
        return divide(value, BigDecimal.valueOf(divisor));
    }

    /**
     * Ratio of two durations, taken at the finest unit where the result is finite and non-zero.
     *
     * <p>When every unit fails the aeon-level ratio is returned as is.</p>
     */
    double ratio(Duration dividend, Duration divisor) {
        Objects.requireNonNull(dividend, "dividend");
        Objects.requireNonNull(divisor, "divisor");
        if (dividend.isZero()) {
            return divisor.isZero() ? Double.NaN : 0.0;
        }
        if (dividend.isPerpetual() || divisor.isZero()) {
            return dividend.isNegative() ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (divisor.isPerpetual()) {
            return 0.0;
        }

        double result = Double.NaN;
        for (DurationUnit unit : RATIO_UNITS) {
            result = dividend.to(unit) / divisor.to(unit);
            if (Double.isFinite(result) && result != 0.0) {
                return result;
            }
            log.debug("Duration ratio not representable in {} (got {}), trying a coarser unit", unit, result);
        }
        return result;
    }

    /**
     * Remainder with the dividend's sign.
     *
     * <p>A perpetual dividend leaves {@code inf - inf}, which is zero. A zero divisor scales an
     * infinite quotient by zero, so nothing is taken away and the dividend comes back, as it does
     * for a perpetual divisor.</p>
     */
    Duration modulus(Duration dividend, Duration divisor) {
        Objects.requireNonNull(dividend, "dividend");
        Objects.requireNonNull(divisor, "divisor");
        if (dividend.isPerpetual()) {
            return Duration.ZERO;
        }
        if (divisor.isZero() || divisor.isPerpetual() || dividend.isZero()) {
            return dividend;
        }
        // Both magnitudes are positive, so mod() is |a| - |b| * floor(|a| / |b|).
        BigInteger remainder = dividend.totalPlanckTime().mod(divisor.totalPlanckTime());
        return new DurationAccumulator()
                .negative(dividend.isNegative())
                .add(DurationUnit.PLANCK_TIME, remainder)
                .toDuration();
    }

    private Duration scale(Duration value, UnaryOperator<BigDecimal> operation, boolean negative) {
        DurationAccumulator accumulator = new DurationAccumulator().negative(negative);
        if (value.getAeons() != null) {
            accumulator.add(DurationUnit.AEON, operation.apply(new BigDecimal(value.getAeons())));
        }
        accumulator.add(DurationUnit.YEAR, operation.apply(BigDecimal.valueOf(value.getYears())));
        accumulator.add(DurationUnit.NANOSECOND, operation.apply(BigDecimal.valueOf(value.getTotalNanoseconds())));
        accumulator.add(DurationUnit.YOCTOSECOND, operation.apply(BigDecimal.valueOf(value.getTotalYoctoseconds())));
        if (value.getPlanckTime() != null) {
            accumulator.add(DurationUnit.PLANCK_TIME, operation.apply(new BigDecimal(value.getPlanckTime())));
        }
        return accumulator.toDuration();
    }

    /**
     * Precision wide enough to keep every digit of the largest quotient down to Planck time;
     * digits beyond it are truncated like any sub-Planck fraction.
     */
    private MathContext divisionContext(Duration value, BigDecimal divisor) {
        int aeonDigits = value.getAeons() == null ? 1 : value.getAeons().toString().length();
        int divisorFractionDigits = Math.max(0, divisor.scale() - divisor.precision() + 1);
        return new MathContext(aeonDigits + divisorFractionDigits + DIVISION_GUARD_DIGITS, RoundingMode.DOWN);
    }
}
