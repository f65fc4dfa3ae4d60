package org.Chronos.core.duration;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Fixed radix constants of the duration chain.
 *
 * <p>A day is always 86,400 seconds and a year is always 365.25 days (31,557,600 seconds).
 * No calendar rules apply anywhere in this library.</p>
 */
public final class DurationUnits {

    /** Years in one aeon. */
    public static final int YEARS_PER_AEON = 1_000_000_000;

    public static final double DAYS_PER_YEAR = 365.25;
    public static final long HOURS_PER_DAY = 24L;
    public static final long MINUTES_PER_HOUR = 60L;
    public static final long SECONDS_PER_MINUTE = 60L;
    public static final long SECONDS_PER_DAY = 86_400L;
    public static final long SECONDS_PER_YEAR = 31_557_600L;
    public static final long MILLISECONDS_PER_SECOND = 1_000L;
    public static final long MICROSECONDS_PER_MILLISECOND = 1_000L;

    public static final long NANOSECONDS_PER_MICROSECOND = 1_000L;
    public static final long NANOSECONDS_PER_MILLISECOND = 1_000_000L;
    public static final long NANOSECONDS_PER_SECOND = 1_000_000_000L;
    public static final long NANOSECONDS_PER_MINUTE = 60_000_000_000L;
    public static final long NANOSECONDS_PER_HOUR = 3_600_000_000_000L;
    public static final long NANOSECONDS_PER_DAY = 86_400_000_000_000L;
    /** Nanoseconds in one fixed-length year; the radix of the nanosecond field. */
    public static final long NANOSECONDS_PER_YEAR = 31_557_600_000_000_000L;

    public static final long YOCTOSECONDS_PER_ZEPTOSECOND = 1_000L;
    public static final long YOCTOSECONDS_PER_ATTOSECOND = 1_000_000L;
    public static final long YOCTOSECONDS_PER_FEMTOSECOND = 1_000_000_000L;
    public static final long YOCTOSECONDS_PER_PICOSECOND = 1_000_000_000_000L;
    /** Yoctoseconds in one nanosecond; the radix of the yoctosecond field. */
    public static final long YOCTOSECONDS_PER_NANOSECOND = 1_000_000_000_000_000L;

    /**
     * Planck-time units in one yoctosecond; the radix of the Planck-time field.
     *
     * <p>Uses the seven significant digits of the measured Planck time (5.391247e-44 s),
     * so it is an approximation rather than a physical constant.</p>
     */
    public static final BigInteger PLANCK_TIME_PER_YOCTOSECOND = new BigInteger("185486100000000000000");

    /** Largest decimal digit count allowed in the aeon or Planck-time magnitude. */
    public static final int MAX_MAGNITUDE_DIGITS = 10_000;

    static final BigInteger YEARS_PER_AEON_BIG = BigInteger.valueOf(YEARS_PER_AEON);
    static final BigInteger NANOSECONDS_PER_YEAR_BIG = BigInteger.valueOf(NANOSECONDS_PER_YEAR);
    static final BigInteger YOCTOSECONDS_PER_NANOSECOND_BIG = BigInteger.valueOf(YOCTOSECONDS_PER_NANOSECOND);
    static final BigDecimal PLANCK_TIME_PER_YOCTOSECOND_DECIMAL = new BigDecimal(PLANCK_TIME_PER_YOCTOSECOND);

    /**
     * Prevents instantiation of this constants holder.
     */
    private DurationUnits() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
