package org.Chronos.core.duration;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.Chronos.core.format.DurationFormatSymbols;
import org.Chronos.core.format.DurationFormatter;
import org.Chronos.core.format.DurationParser;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable absolute duration from a single Planck-time unit up to an unbounded number of
 * aeons, with exact arithmetic.
 *
 * <p>The magnitude is stored as five radix-chained fields, most significant first:</p>
 * <ul>
 *     <li>{@code aeons}: whole aeons, unbounded, {@code null} when zero;</li>
 *     <li>{@code years}: years within the aeon, {@code [0, YEARS_PER_AEON)};</li>
 *     <li>{@code totalNanoseconds}: nanoseconds within the year, {@code [0, NANOSECONDS_PER_YEAR)};</li>
 *     <li>{@code totalYoctoseconds}: yoctoseconds within the nanosecond, {@code [0, YOCTOSECONDS_PER_NANOSECOND)};</li>
 *     <li>{@code planckTime}: Planck-time units within the yoctosecond, {@code [0, PLANCK_TIME_PER_YOCTOSECOND)},
 *     {@code null} when zero.</li>
 * </ul>
 *
 * <p>The sign applies to the whole value. A perpetual duration is positive or negative infinity and
 * has every magnitude field cleared. {@link #ZERO} is the only zero instance; negative zero is
 * normalized away. Every instance is canonical, so structural equality is numeric equality.</p>
 *
 * <p>Instances come from two factories: {@link #fromComponents} (and its {@link #builder()}) normalizes
 * arbitrary component amounts, while {@link #fromCanonicalFields} stores already canonical fields and
 * rejects anything out of range.</p>
 */
@Getter
@EqualsAndHashCode
public final class Duration implements Comparable<Duration> {

    /** The zero duration. */
    public static final Duration ZERO = new Duration(false, false, null, 0L, 0L, 0, null);

    /** Positive perpetual duration. */
    public static final Duration POSITIVE_INFINITY = new Duration(false, true, null, 0L, 0L, 0, null);

    /** Negative perpetual duration. */
    public static final Duration NEGATIVE_INFINITY = new Duration(true, true, null, 0L, 0L, 0, null);

    /** Alias of {@link #POSITIVE_INFINITY}. */
    public static final Duration PERPETUAL = POSITIVE_INFINITY;

    public static final Duration ONE_AEON = of(1L, DurationUnit.AEON);
    public static final Duration ONE_YEAR = of(1L, DurationUnit.YEAR);
    public static final Duration ONE_DAY = of(1L, DurationUnit.DAY);
    public static final Duration ONE_HOUR = of(1L, DurationUnit.HOUR);
    public static final Duration ONE_MINUTE = of(1L, DurationUnit.MINUTE);
    public static final Duration ONE_SECOND = of(1L, DurationUnit.SECOND);
    public static final Duration ONE_MILLISECOND = of(1L, DurationUnit.MILLISECOND);
    public static final Duration ONE_MICROSECOND = of(1L, DurationUnit.MICROSECOND);
    public static final Duration ONE_NANOSECOND = of(1L, DurationUnit.NANOSECOND);
    public static final Duration ONE_PICOSECOND = of(1L, DurationUnit.PICOSECOND);
    public static final Duration ONE_FEMTOSECOND = of(1L, DurationUnit.FEMTOSECOND);
    public static final Duration ONE_ATTOSECOND = of(1L, DurationUnit.ATTOSECOND);
    public static final Duration ONE_ZEPTOSECOND = of(1L, DurationUnit.ZEPTOSECOND);
    public static final Duration ONE_YOCTOSECOND = of(1L, DurationUnit.YOCTOSECOND);
    public static final Duration ONE_PLANCK_TIME = of(1L, DurationUnit.PLANCK_TIME);

    private static final MathContext PROJECTION_CONTEXT = new MathContext(40);

    /** Whether the whole value is negative. */
    private final boolean negative;
    /** Whether the value is infinite. */
    private final boolean perpetual;
    /** Planck-time units within the current yoctosecond, {@code null} when zero. */
    private final BigInteger planckTime;
    /** Yoctoseconds within the current nanosecond. */
    private final long totalYoctoseconds;
    /** Nanoseconds within the current year. */
    private final long totalNanoseconds;
    /** Years within the current aeon. */
    private final int years;
    /** Whole aeons, {@code null} when zero. */
    private final BigInteger aeons;

    private Duration(
            boolean negative,
            boolean perpetual,
            BigInteger planckTime,
            long totalYoctoseconds,
            long totalNanoseconds,
            int years,
            BigInteger aeons
    ) {
        this.negative = negative;
        this.perpetual = perpetual;
        this.planckTime = planckTime;
        this.totalYoctoseconds = totalYoctoseconds;
        this.totalNanoseconds = totalNanoseconds;
        this.years = years;
        this.aeons = aeons;
    }

    // ========== Construction ==========

    /**
     * Stores already canonical fields without renormalizing them.
     *
     * <p>Zero-valued {@link BigInteger} fields are stored as {@code null}, perpetual values drop their
     * magnitude fields and negative zero becomes {@link #ZERO}.</p>
     *
     * @param negative sign of the value.
     * @param perpetual whether the value is infinite.
     * @param planckTime Planck-time units within the yoctosecond, nullable.
     * @param totalYoctoseconds yoctoseconds within the nanosecond.
     * @param totalNanoseconds nanoseconds within the year.
     * @param years years within the aeon.
     * @param aeons whole aeons, nullable.
     * @return the duration.
     * @throws IllegalArgumentException when any field lies outside its radix range.
     */
    public static Duration fromCanonicalFields(
            boolean negative,
            boolean perpetual,
            BigInteger planckTime,
            long totalYoctoseconds,
            long totalNanoseconds,
            int years,
            BigInteger aeons
    ) {
        if (perpetual) {
            return negative ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        }
        BigInteger planck = nullIfZero(planckTime);
        if (planck != null && (planck.signum() < 0 || planck.compareTo(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND) >= 0)) {
            throw new IllegalArgumentException("planckTime out of range: " + planck);
        }
        requireRange(totalYoctoseconds, DurationUnits.YOCTOSECONDS_PER_NANOSECOND, "totalYoctoseconds");
        requireRange(totalNanoseconds, DurationUnits.NANOSECONDS_PER_YEAR, "totalNanoseconds");
        requireRange(years, DurationUnits.YEARS_PER_AEON, "years");
        BigInteger wholeAeons = nullIfZero(aeons);
        if (wholeAeons != null && wholeAeons.signum() < 0) {
            throw new IllegalArgumentException("aeons must be >= 0, got " + wholeAeons);
        }
        DurationAccumulator.checkDigits(wholeAeons, "aeons");

        if (planck == null && totalYoctoseconds == 0L && totalNanoseconds == 0L && years == 0 && wholeAeons == null) {
            return ZERO;
        }
        return new Duration(negative, false, planck, totalYoctoseconds, totalNanoseconds, years, wholeAeons);
    }

    /**
     * Builds a duration from arbitrary non-negative component amounts, carrying every overflow into
     * the next coarser field.
     *
     * <p>Prefer {@link #builder()} when only a few components are set.</p>
     *
     * @return the normalized duration.
     * @throws IllegalArgumentException when any component is negative.
     * @throws DurationOverflowException when the aeon count exceeds the digit limit.
     */
    @Builder(builderMethodName = "builder")
    public static Duration fromComponents(
            boolean negative,
            BigInteger aeons,
            long years,
            long days,
            long hours,
            long minutes,
            long seconds,
            long milliseconds,
            long microseconds,
            long nanoseconds,
            long picoseconds,
            long femtoseconds,
            long attoseconds,
            long zeptoseconds,
            long yoctoseconds,
            BigInteger planckTime
    ) {
        DurationAccumulator accumulator = new DurationAccumulator().negative(negative);
        if (aeons != null) {
            accumulator.add(DurationUnit.AEON, aeons);
        }
        accumulator.add(DurationUnit.YEAR, years)
                .add(DurationUnit.DAY, days)
                .add(DurationUnit.HOUR, hours)
                .add(DurationUnit.MINUTE, minutes)
                .add(DurationUnit.SECOND, seconds)
                .add(DurationUnit.MILLISECOND, milliseconds)
                .add(DurationUnit.MICROSECOND, microseconds)
                .add(DurationUnit.NANOSECOND, nanoseconds)
                .add(DurationUnit.PICOSECOND, picoseconds)
                .add(DurationUnit.FEMTOSECOND, femtoseconds)
                .add(DurationUnit.ATTOSECOND, attoseconds)
                .add(DurationUnit.ZEPTOSECOND, zeptoseconds)
                .add(DurationUnit.YOCTOSECOND, yoctoseconds);
        if (planckTime != null) {
            accumulator.add(DurationUnit.PLANCK_TIME, planckTime);
        }
        return accumulator.toDuration();
    }

    /**
     * Creates a duration from an exact, possibly fractional and signed amount of {@code unit}.
     *
     * <p>Fractions finer than one Planck-time unit are truncated.</p>
     *
     * @param amount signed amount.
     * @param unit unit of the amount.
     * @return the normalized duration.
     */
    public static Duration of(BigDecimal amount, DurationUnit unit) {
        Objects.requireNonNull(amount, "amount");
        return new DurationAccumulator()
                .negative(amount.signum() < 0)
                .add(unit, amount.abs())
                .toDuration();
    }

    /**
     * Creates a duration from a signed whole amount of {@code unit}.
     *
     * @param amount signed amount.
     * @param unit unit of the amount.
     * @return the normalized duration.
     */
    public static Duration of(BigInteger amount, DurationUnit unit) {
        Objects.requireNonNull(amount, "amount");
        return new DurationAccumulator()
                .negative(amount.signum() < 0)
                .add(unit, amount.abs())
                .toDuration();
    }

    /**
     * Creates a duration from a signed whole amount of {@code unit}.
     *
     * @param amount signed amount.
     * @param unit unit of the amount.
     * @return the normalized duration.
     */
    public static Duration of(long amount, DurationUnit unit) {
        return of(BigInteger.valueOf(amount), unit);
    }

    /**
     * Creates a duration from a binary floating-point amount of {@code unit}.
     *
     * <p>Infinite amounts give the perpetual duration of the same sign. The amount is read through its
     * shortest decimal representation.</p>
     *
     * @param amount signed amount.
     * @param unit unit of the amount.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code amount} is NaN.
     */
    public static Duration of(double amount, DurationUnit unit) {
        if (Double.isNaN(amount)) {
            throw new IllegalArgumentException(unit + " amount must not be NaN");
        }
        if (Double.isInfinite(amount)) {
            return perpetual(amount < 0);
        }
        return of(BigDecimal.valueOf(amount), unit);
    }

    /**
     * Creates a duration of {@code aeons} aeons.
     *
     * @param aeons signed amount of aeons.
     * @return the normalized duration.
     */
    public static Duration fromAeons(BigInteger aeons) {
        return of(aeons, DurationUnit.AEON);
    }

    /**
     * Creates a duration of {@code aeons} aeons. Infinities give a perpetual value.
     *
     * @param aeons signed amount of aeons.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code aeons} is NaN.
     */
    public static Duration fromAeons(double aeons) {
        return of(aeons, DurationUnit.AEON);
    }

    /**
     * Creates a duration of {@code years} years.
     *
     * @param years signed amount of years.
     * @return the normalized duration.
     */
    public static Duration fromYears(long years) {
        return of(years, DurationUnit.YEAR);
    }

    /**
     * Creates a duration of {@code years} years; the fraction spills into finer fields.
     *
     * @param years signed amount of years.
     * @return the normalized duration.
     */
    public static Duration fromYears(BigDecimal years) {
        return of(years, DurationUnit.YEAR);
    }

    /**
     * Creates a duration of {@code years} years. Infinities give a perpetual value.
     *
     * @param years signed amount of years.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code years} is NaN.
     */
    public static Duration fromYears(double years) {
        return of(years, DurationUnit.YEAR);
    }

    /**
     * Creates a duration of {@code days} days.
     *
     * @param days signed amount of days.
     * @return the normalized duration.
     */
    public static Duration fromDays(long days) {
        return of(days, DurationUnit.DAY);
    }

    /**
     * Creates a duration of {@code days} days. Infinities give a perpetual value.
     *
     * @param days signed amount of days.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code days} is NaN.
     */
    public static Duration fromDays(double days) {
        return of(days, DurationUnit.DAY);
    }

    /**
     * Creates a duration of {@code hours} hours.
     *
     * @param hours signed amount of hours.
     * @return the normalized duration.
     */
    public static Duration fromHours(long hours) {
        return of(hours, DurationUnit.HOUR);
    }

    /**
     * Creates a duration of {@code hours} hours. Infinities give a perpetual value.
     *
     * @param hours signed amount of hours.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code hours} is NaN.
     */
    public static Duration fromHours(double hours) {
        return of(hours, DurationUnit.HOUR);
    }

    /**
     * Creates a duration of {@code minutes} minutes.
     *
     * @param minutes signed amount of minutes.
     * @return the normalized duration.
     */
    public static Duration fromMinutes(long minutes) {
        return of(minutes, DurationUnit.MINUTE);
    }

    /**
     * Creates a duration of {@code minutes} minutes. Infinities give a perpetual value.
     *
     * @param minutes signed amount of minutes.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code minutes} is NaN.
     */
    public static Duration fromMinutes(double minutes) {
        return of(minutes, DurationUnit.MINUTE);
    }

    /**
     * Creates a duration of {@code seconds} seconds.
     *
     * @param seconds signed amount of seconds.
     * @return the normalized duration.
     */
    public static Duration fromSeconds(long seconds) {
        return of(seconds, DurationUnit.SECOND);
    }

    /**
     * Creates a duration of {@code seconds} seconds; the fraction spills into finer fields.
     *
     * @param seconds signed amount of seconds.
     * @return the normalized duration.
     */
    public static Duration fromSeconds(BigDecimal seconds) {
        return of(seconds, DurationUnit.SECOND);
    }

    /**
     * Creates a duration of {@code seconds} seconds. Infinities give a perpetual value.
     *
     * @param seconds signed amount of seconds.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code seconds} is NaN.
     */
    public static Duration fromSeconds(double seconds) {
        return of(seconds, DurationUnit.SECOND);
    }

    /**
     * Creates a duration of {@code milliseconds} milliseconds.
     *
     * @param milliseconds signed amount of milliseconds.
     * @return the normalized duration.
     */
    public static Duration fromMilliseconds(long milliseconds) {
        return of(milliseconds, DurationUnit.MILLISECOND);
    }

    /**
     * Creates a duration of {@code microseconds} microseconds.
     *
     * @param microseconds signed amount of microseconds.
     * @return the normalized duration.
     */
    public static Duration fromMicroseconds(long microseconds) {
        return of(microseconds, DurationUnit.MICROSECOND);
    }

    /**
     * Creates a duration of {@code nanoseconds} nanoseconds.
     *
     * @param nanoseconds signed amount of nanoseconds.
     * @return the normalized duration.
     */
    public static Duration fromNanoseconds(long nanoseconds) {
        return of(nanoseconds, DurationUnit.NANOSECOND);
    }

    /**
     * Creates a duration of {@code nanoseconds} nanoseconds.
     *
     * @param nanoseconds signed amount of nanoseconds.
     * @return the normalized duration.
     */
    public static Duration fromNanoseconds(BigInteger nanoseconds) {
        return of(nanoseconds, DurationUnit.NANOSECOND);
    }

    /**
     * Creates a duration of {@code picoseconds} picoseconds.
     *
     * @param picoseconds signed amount of picoseconds.
     * @return the normalized duration.
     */
    public static Duration fromPicoseconds(long picoseconds) {
        return of(picoseconds, DurationUnit.PICOSECOND);
    }

    /**
     * Creates a duration of {@code femtoseconds} femtoseconds.
     *
     * @param femtoseconds signed amount of femtoseconds.
     * @return the normalized duration.
     */
    public static Duration fromFemtoseconds(long femtoseconds) {
        return of(femtoseconds, DurationUnit.FEMTOSECOND);
    }

    /**
     * Creates a duration of {@code attoseconds} attoseconds.
     *
     * @param attoseconds signed amount of attoseconds.
     * @return the normalized duration.
     */
    public static Duration fromAttoseconds(long attoseconds) {
        return of(attoseconds, DurationUnit.ATTOSECOND);
    }

    /**
     * Creates a duration of {@code zeptoseconds} zeptoseconds.
     *
     * @param zeptoseconds signed amount of zeptoseconds.
     * @return the normalized duration.
     */
    public static Duration fromZeptoseconds(long zeptoseconds) {
        return of(zeptoseconds, DurationUnit.ZEPTOSECOND);
    }

    /**
     * Creates a duration of {@code yoctoseconds} yoctoseconds.
     *
     * @param yoctoseconds signed amount of yoctoseconds.
     * @return the normalized duration.
     */
    public static Duration fromYoctoseconds(long yoctoseconds) {
        return of(yoctoseconds, DurationUnit.YOCTOSECOND);
    }

    /**
     * Creates a duration of {@code yoctoseconds} yoctoseconds.
     *
     * @param yoctoseconds signed amount of yoctoseconds.
     * @return the normalized duration.
     */
    public static Duration fromYoctoseconds(BigInteger yoctoseconds) {
        return of(yoctoseconds, DurationUnit.YOCTOSECOND);
    }

    /**
     * Creates a duration of {@code planckTime} Planck-time units.
     *
     * @param planckTime signed amount of Planck-time units.
     * @return the normalized duration.
     */
    public static Duration fromPlanckTime(BigInteger planckTime) {
        return of(planckTime, DurationUnit.PLANCK_TIME);
    }

    /**
     * Creates a duration of {@code planckTime} Planck-time units. Infinities give a perpetual value.
     *
     * @param planckTime signed amount of Planck-time units.
     * @return the normalized duration.
     * @throws IllegalArgumentException when {@code planckTime} is NaN.
     */
    public static Duration fromPlanckTime(double planckTime) {
        return of(planckTime, DurationUnit.PLANCK_TIME);
    }

    /**
     * Returns the given proportion of a fixed-length day.
     *
     * @param proportion non-negative fraction of a day.
     */
    public static Duration fromProportionOfDay(BigDecimal proportion) {
        return ONE_DAY.multiply(proportion);
    }

    /**
     * Returns the given proportion of a fixed-length year.
     *
     * @param proportion non-negative fraction of a year.
     */
    public static Duration fromProportionOfYear(BigDecimal proportion) {
        return ONE_YEAR.multiply(proportion);
    }

    /**
     * Returns the perpetual duration with the requested sign.
     */
    public static Duration perpetual(boolean negative) {
        return negative ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
    }

    // ========== Derived views ==========

    /**
     * Returns {@code true} when the value is finite and every magnitude field is zero.
     */
    public boolean isZero() {
        return !perpetual
                && aeons == null
                && years == 0
                && totalNanoseconds == 0L
                && totalYoctoseconds == 0L
                && planckTime == null;
    }

    /**
     * Returns -1, 0 or +1. Zero reports 0 whatever its stored sign.
     */
    public int sign() {
        if (isZero()) {
            return 0;
        }
        return negative ? -1 : 1;
    }

    /**
     * Returns whether this is {@link #POSITIVE_INFINITY}.
     */
    public boolean isPositiveInfinity() {
        return perpetual && !negative;
    }

    /**
     * Returns whether this is {@link #NEGATIVE_INFINITY}.
     */
    public boolean isNegativeInfinity() {
        return perpetual && negative;
    }

    /**
     * Returns whole years including those folded into aeons.
     */
    public BigInteger getTotalYears() {
        return aeonsOrZero().multiply(DurationUnits.YEARS_PER_AEON_BIG).add(BigInteger.valueOf(years));
    }

    /**
     * Returns whole days within the current year.
     */
    public long getDays() {
        return totalNanoseconds / DurationUnits.NANOSECONDS_PER_DAY;
    }

    /**
     * Returns hours within the current day.
     */
    public long getHours() {
        return totalNanoseconds / DurationUnits.NANOSECONDS_PER_HOUR % DurationUnits.HOURS_PER_DAY;
    }

    /**
     * Returns minutes within the current hour.
     */
    public long getMinutes() {
        return totalNanoseconds / DurationUnits.NANOSECONDS_PER_MINUTE % DurationUnits.MINUTES_PER_HOUR;
    }

    /**
     * Returns seconds within the current minute.
     */
    public long getSeconds() {
        return totalNanoseconds / DurationUnits.NANOSECONDS_PER_SECOND % DurationUnits.SECONDS_PER_MINUTE;
    }

    /**
     * Returns milliseconds within the current second.
     */
    public long getMilliseconds() {
        return totalNanoseconds / DurationUnits.NANOSECONDS_PER_MILLISECOND % DurationUnits.MILLISECONDS_PER_SECOND;
    }

    /**
     * Returns microseconds within the current millisecond.
     */
    public long getMicroseconds() {
        return totalNanoseconds / DurationUnits.NANOSECONDS_PER_MICROSECOND % DurationUnits.MICROSECONDS_PER_MILLISECOND;
    }

    /**
     * Returns nanoseconds within the current microsecond.
     */
    public long getNanoseconds() {
        return totalNanoseconds % DurationUnits.NANOSECONDS_PER_MICROSECOND;
    }

    /**
     * Returns picoseconds within the current nanosecond.
     */
    public long getPicoseconds() {
        return totalYoctoseconds / DurationUnits.YOCTOSECONDS_PER_PICOSECOND;
    }

    /**
     * Returns femtoseconds within the current picosecond.
     */
    public long getFemtoseconds() {
        return totalYoctoseconds / DurationUnits.YOCTOSECONDS_PER_FEMTOSECOND % 1_000L;
    }

    /**
     * Returns attoseconds within the current femtosecond.
     */
    public long getAttoseconds() {
        return totalYoctoseconds / DurationUnits.YOCTOSECONDS_PER_ATTOSECOND % 1_000L;
    }

    /**
     * Returns zeptoseconds within the current attosecond.
     */
    public long getZeptoseconds() {
        return totalYoctoseconds / DurationUnits.YOCTOSECONDS_PER_ZEPTOSECOND % 1_000L;
    }

    /**
     * Returns yoctoseconds within the current zeptosecond.
     */
    public long getYoctoseconds() {
        return totalYoctoseconds % DurationUnits.YOCTOSECONDS_PER_ZEPTOSECOND;
    }

    BigInteger aeonsOrZero() {
        return aeons == null ? BigInteger.ZERO : aeons;
    }

    BigInteger planckTimeOrZero() {
        return planckTime == null ? BigInteger.ZERO : planckTime;
    }

    /**
     * Encodes the magnitude as a single count of Planck-time units.
     */
    BigInteger totalPlanckTime() {
        return totalYoctosecondsExact()
                .multiply(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND)
                .add(planckTimeOrZero());
    }

    private BigInteger totalYoctosecondsExact() {
        return getTotalYears()
                .multiply(DurationUnits.NANOSECONDS_PER_YEAR_BIG)
                .add(BigInteger.valueOf(totalNanoseconds))
                .multiply(DurationUnits.YOCTOSECONDS_PER_NANOSECOND_BIG)
                .add(BigInteger.valueOf(totalYoctoseconds));
    }

    // ========== Floating-point projections ==========

    /**
     * Projects the value onto {@code unit} as a double.
     *
     * <p>Perpetual values give a signed infinity; magnitudes beyond the double range overflow to
     * infinity as well.</p>
     *
     * @param unit target unit.
     * @return signed amount of {@code unit}.
     */
    public double to(DurationUnit unit) {
        Objects.requireNonNull(unit, "unit");
        if (perpetual) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (isZero()) {
            return 0.0;
        }
        double magnitude;
        if (unit == DurationUnit.PLANCK_TIME) {
            magnitude = new BigDecimal(totalPlanckTime()).doubleValue();
        } else {
            BigDecimal yoctoseconds = new BigDecimal(totalYoctosecondsExact());
            if (planckTime != null) {
                yoctoseconds = yoctoseconds.add(new BigDecimal(planckTime)
                        .divide(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND_DECIMAL, PROJECTION_CONTEXT));
            }
            magnitude = yoctoseconds.divide(yoctosecondsPerUnit(unit), PROJECTION_CONTEXT).doubleValue();
        }
        return negative ? -magnitude : magnitude;
    }

    private static BigDecimal yoctosecondsPerUnit(DurationUnit unit) {
        BigInteger perUnit = unit.unitsInField();
        switch (unit.field()) {
            case AEONS:
                perUnit = perUnit.multiply(DurationUnits.YEARS_PER_AEON_BIG);
                // fall through
            case YEARS:
                perUnit = perUnit.multiply(DurationUnits.NANOSECONDS_PER_YEAR_BIG);
                // fall through
            case NANOSECONDS:
                perUnit = perUnit.multiply(DurationUnits.YOCTOSECONDS_PER_NANOSECOND_BIG);
                break;
            default:
                break;
        }
        return new BigDecimal(perUnit);
    }

    /**
     * Projects this duration onto aeons; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of aeons.
     */
    public double toAeons() {
        return to(DurationUnit.AEON);
    }

    /**
     * Projects this duration onto years; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of years.
     */
    public double toYears() {
        return to(DurationUnit.YEAR);
    }

    /**
     * Projects this duration onto days; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of days.
     */
    public double toDays() {
        return to(DurationUnit.DAY);
    }

    /**
     * Projects this duration onto hours; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of hours.
     */
    public double toHours() {
        return to(DurationUnit.HOUR);
    }

    /**
     * Projects this duration onto minutes; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of minutes.
     */
    public double toMinutes() {
        return to(DurationUnit.MINUTE);
    }

    /**
     * Projects this duration onto seconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of seconds.
     */
    public double toSeconds() {
        return to(DurationUnit.SECOND);
    }

    /**
     * Projects this duration onto milliseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of milliseconds.
     */
    public double toMilliseconds() {
        return to(DurationUnit.MILLISECOND);
    }

    /**
     * Projects this duration onto microseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of microseconds.
     */
    public double toMicroseconds() {
        return to(DurationUnit.MICROSECOND);
    }

    /**
     * Projects this duration onto nanoseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of nanoseconds.
     */
    public double toNanoseconds() {
        return to(DurationUnit.NANOSECOND);
    }

    /**
     * Projects this duration onto picoseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of picoseconds.
     */
    public double toPicoseconds() {
        return to(DurationUnit.PICOSECOND);
    }

    /**
     * Projects this duration onto femtoseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of femtoseconds.
     */
    public double toFemtoseconds() {
        return to(DurationUnit.FEMTOSECOND);
    }

    /**
     * Projects this duration onto attoseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of attoseconds.
     */
    public double toAttoseconds() {
        return to(DurationUnit.ATTOSECOND);
    }

    /**
     * Projects this duration onto zeptoseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of zeptoseconds.
     */
    public double toZeptoseconds() {
        return to(DurationUnit.ZEPTOSECOND);
    }

    /**
     * Projects this duration onto yoctoseconds; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of yoctoseconds.
     */
    public double toYoctoseconds() {
        return to(DurationUnit.YOCTOSECOND);
    }

    /**
     * Projects this duration onto Planck-time units; see {@link #to(DurationUnit)}.
     *
     * @return signed amount of Planck-time units.
     */
    public double toPlanckTime() {
        return to(DurationUnit.PLANCK_TIME);
    }

    // ========== Exact arithmetic ==========

    /**
     * Returns this duration with the opposite sign; zero and the fields are unchanged.
     *
     * @return the negated duration.
     */
    public Duration negate() {
        return ExactArithmetic.negate(this);
    }

    /**
     * Returns the magnitude of this duration.
     */
    public Duration abs() {
        return negative ? negate() : this;
    }

    /**
     * Adds {@code other} exactly, carrying from Planck time up to aeons.
     *
     * <p>Opposite perpetual values sum to zero.</p>
     *
     * @param other duration to add.
     * @return the exact sum.
     */
    public Duration add(Duration other) {
        return ExactArithmetic.add(this, other);
    }

    /**
     * Subtracts {@code other} exactly, borrowing from aeons down to Planck time.
     *
     * @param other duration to subtract.
     * @return the exact difference.
     */
    public Duration subtract(Duration other) {
        return ExactArithmetic.subtract(this, other);
    }

    /**
     * Orders by sign first, then by magnitude field by field; perpetual values lie outside every
     * finite value.
     */
    @Override
    public int compareTo(Duration other) {
        return ExactArithmetic.compare(this, other);
    }

    /**
     * Returns the larger of two durations, {@code first} on a tie.
     *
     * @param first first duration.
     * @param second second duration.
     * @return the larger value.
     */
    public static Duration max(Duration first, Duration second) {
        return first.compareTo(second) >= 0 ? first : second;
    }

    /**
     * Returns the smaller of two durations, {@code first} on a tie.
     *
     * @param first first duration.
     * @param second second duration.
     * @return the smaller value.
     */
    public static Duration min(Duration first, Duration second) {
        return first.compareTo(second) <= 0 ? first : second;
    }

    // ========== Scaled arithmetic ==========

    /**
     * Multiplies this duration by an exact factor.
     *
     * @param factor scaling factor.
     * @return the scaled duration.
     */
    public Duration multiply(BigDecimal factor) {
        return ScaledArithmetic.multiply(this, factor);
    }

    /**
     * Multiplies this duration by a whole factor.
     *
     * @param factor scaling factor.
     * @return the scaled duration.
     */
    public Duration multiply(long factor) {
        return ScaledArithmetic.multiply(this, BigDecimal.valueOf(factor));
    }

    /**
     * Multiplies this duration by a floating-point factor.
     *
     * @param factor scaling factor; infinite factors give a perpetual result.
     * @return the scaled duration.
     * @throws IllegalArgumentException when {@code factor} is NaN.
     */
    public Duration multiply(double factor) {
        return ScaledArithmetic.multiply(this, factor);
    }

    /**
     * Divides this duration by an exact divisor, truncating below one Planck time.
     *
     * @param divisor divisor; zero gives a perpetual result.
     * @return the scaled duration.
     */
    public Duration divide(BigDecimal divisor) {
        return ScaledArithmetic.divide(this, divisor);
    }

    /**
     * Divides this duration by a whole divisor, truncating below one Planck time.
     *
     * @param divisor divisor; zero gives a perpetual result.
     * @return the scaled duration.
     */
    public Duration divide(long divisor) {
        return ScaledArithmetic.divide(this, BigDecimal.valueOf(divisor));
    }

    /**
     * Divides this duration by a floating-point divisor.
     *
     * @param divisor divisor; zero gives a perpetual result, infinity gives zero.
     * @return the scaled duration.
     * @throws IllegalArgumentException when {@code divisor} is NaN.
     */
    public Duration divide(double divisor) {
        return ScaledArithmetic.divide(this, divisor);
    }

    /**
     * Returns the ratio of this duration to {@code divisor}.
     *
     * <p>The ratio is taken at the finest common unit where both values fit in a double, so very large
     * values lose precision rather than overflowing.</p>
     *
     * @param divisor duration to divide by.
     * @return ratio; NaN for zero over zero, an infinity with this duration's sign when this
     *         duration is perpetual or {@code divisor} is zero.
     */
    public double divide(Duration divisor) {
        return ScaledArithmetic.ratio(this, divisor);
    }

    /**
     * Returns {@code sign(this) * (|this| - |divisor| * floor(|this| / |divisor|))}.
     *
     * <p>A perpetual dividend gives zero; a zero or perpetual divisor gives this duration.</p>
     *
     * @param divisor duration to divide by.
     * @return the exact remainder.
     */
    public Duration modulus(Duration divisor) {
        return ScaledArithmetic.modulus(this, divisor);
    }

    // ========== Text ==========

    /**
     * Formats with {@code pattern} and invariant symbols.
     */
    public String format(String pattern) {
        return DurationFormatter.format(this, pattern, DurationFormatSymbols.invariant());
    }

    /**
     * Formats with {@code pattern} and the symbols of {@code locale}.
     */
    public String format(String pattern, Locale locale) {
        return DurationFormatter.format(this, pattern, DurationFormatSymbols.of(locale));
    }

    /**
     * Formats with {@code pattern}.
     *
     * @param pattern standard or custom pattern; {@code null} or blank selects {@code G}.
     * @param symbols culture symbols.
     * @return formatted text.
     */
    public String format(String pattern, DurationFormatSymbols symbols) {
        return DurationFormatter.format(this, pattern, symbols);
    }

    /**
     * Parses with invariant symbols, trying every standard pattern.
     *
     * @throws org.Chronos.core.format.DurationFormatException when no standard pattern matches.
     */
    public static Duration parse(String text) {
        return DurationParser.parse(text, DurationFormatSymbols.invariant());
    }

    /**
     * Parses by trying every standard pattern.
     *
     * @param text input text.
     * @param symbols culture symbols.
     * @return the first successful result.
     * @throws org.Chronos.core.format.DurationFormatException when no standard pattern matches.
     */
    public static Duration parse(String text, DurationFormatSymbols symbols) {
        return DurationParser.parse(text, symbols);
    }

    /**
     * Like {@link #parse(String)} but reports failure as an empty result.
     */
    public static Optional<Duration> tryParse(String text) {
        return DurationParser.tryParse(text, DurationFormatSymbols.invariant());
    }

    /**
     * Parses under exactly one pattern with invariant symbols.
     */
    public static Duration parseExact(String text, String pattern) {
        return DurationParser.parseExact(text, pattern, DurationFormatSymbols.invariant());
    }

    /**
     * Parses under exactly one pattern.
     *
     * @param text input text.
     * @param pattern standard or custom pattern.
     * @param symbols culture symbols.
     * @return the parsed duration.
     * @throws org.Chronos.core.format.DurationFormatException when the text does not match.
     */
    public static Duration parseExact(String text, String pattern, DurationFormatSymbols symbols) {
        return DurationParser.parseExact(text, pattern, symbols);
    }

    /**
     * Like {@link #parseExact(String, String)} but reports failure as an empty result.
     */
    public static Optional<Duration> tryParseExact(String text, String pattern) {
        return DurationParser.tryParseExact(text, pattern, DurationFormatSymbols.invariant());
    }

    /**
     * Formats with the general pattern {@code G} and invariant symbols.
     */
    @Override
    public String toString() {
        return format("G");
    }

    private static BigInteger nullIfZero(BigInteger value) {
        return value == null || value.signum() == 0 ? null : value;
    }

    private static void requireRange(long value, long radix, String name) {
        if (value < 0L || value >= radix) {
            throw new IllegalArgumentException(name + " must be in [0, " + radix + "), got " + value);
        }
    }
}
