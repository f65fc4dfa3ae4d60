package org.Chronos.core.relative;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.Chronos.core.duration.Duration;
import org.Chronos.core.format.DurationFormatException;
import org.Chronos.core.format.DurationFormatSymbols;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;
import java.util.Optional;

/**
 * A duration that is either literal or a proportion of a day or year whose length is only known
 * in context (for example the local day of another planet).
 *
 * <p>Text form: absolute values use the {@link Duration} patterns, proportions are written
 * {@code Dx<proportion>} or {@code Yx<proportion>}.</p>
 */
@Getter
@EqualsAndHashCode
public final class RelativeDuration {
    private static final String DAY_PREFIX = "Dx";
    private static final String YEAR_PREFIX = "Yx";

    public static final RelativeDuration ZERO = new RelativeDuration(RelativeDurationType.ABSOLUTE, Duration.ZERO, BigDecimal.ZERO);
    public static final RelativeDuration POSITIVE_INFINITY =
            new RelativeDuration(RelativeDurationType.ABSOLUTE, Duration.POSITIVE_INFINITY, BigDecimal.ZERO);
    public static final RelativeDuration NEGATIVE_INFINITY =
            new RelativeDuration(RelativeDurationType.ABSOLUTE, Duration.NEGATIVE_INFINITY, BigDecimal.ZERO);

    private final RelativeDurationType relativity;
    /** Literal duration; {@link Duration#ZERO} for proportions. */
    private final Duration duration;
    /** Non-negative proportion without trailing zeros; zero for absolute values. */
    private final BigDecimal proportion;

    private RelativeDuration(RelativeDurationType relativity, Duration duration, BigDecimal proportion) {
        this.relativity = relativity;
        this.duration = duration;
        this.proportion = proportion;
    }

    public static RelativeDuration of(Duration duration) {
        return new RelativeDuration(RelativeDurationType.ABSOLUTE, Objects.requireNonNull(duration, "duration"), BigDecimal.ZERO);
    }

    /**
     * Creates a proportion of the local day. Negative proportions clamp to zero.
     */
    public static RelativeDuration fromProportionOfDay(BigDecimal proportion) {
        return proportionOf(RelativeDurationType.PROPORTION_OF_DAY, proportion);
    }

    public static RelativeDuration fromProportionOfDay(double proportion) {
        return fromProportionOfDay(toDecimal(proportion));
    }

    /**
     * Creates a proportion of the local year. Negative proportions clamp to zero.
     */
    public static RelativeDuration fromProportionOfYear(BigDecimal proportion) {
        return proportionOf(RelativeDurationType.PROPORTION_OF_YEAR, proportion);
    }

    public static RelativeDuration fromProportionOfYear(double proportion) {
        return fromProportionOfYear(toDecimal(proportion));
    }

    private static RelativeDuration proportionOf(RelativeDurationType relativity, BigDecimal proportion) {
        Objects.requireNonNull(proportion, "proportion");
        BigDecimal clamped = proportion.signum() < 0 ? BigDecimal.ZERO : proportion.stripTrailingZeros();
        return new RelativeDuration(relativity, Duration.ZERO, clamped);
    }

    public boolean isPerpetual() {
        return relativity == RelativeDurationType.ABSOLUTE && duration.isPerpetual();
    }

    public boolean isZero() {
        return relativity == RelativeDurationType.ABSOLUTE ? duration.isZero() : proportion.signum() == 0;
    }

    /**
     * Returns {@code true} when this is an absolute value equal to {@code other}.
     */
    public boolean equalsDuration(Duration other) {
        return relativity == RelativeDurationType.ABSOLUTE && duration.equals(other);
    }

    /**
     * Resolves this value against the lengths of the local year and day.
     *
     * @param localYear length of the local year.
     * @param localDay length of the local day.
     * @return the absolute duration.
     */
    public Duration toDuration(Duration localYear, Duration localDay) {
        Objects.requireNonNull(localYear, "localYear");
        Objects.requireNonNull(localDay, "localDay");
        switch (relativity) {
            case PROPORTION_OF_DAY:
                return localDay.multiply(proportion);
            case PROPORTION_OF_YEAR:
                return localYear.multiply(proportion);
            case ABSOLUTE:
            default:
                return duration;
        }
    }

    /**
     * Scales this value.
     *
     * <p>Non-positive factors give {@link #ZERO}; a perpetual value or an infinite factor gives
     * {@link #POSITIVE_INFINITY}.</p>
     *
     * @param factor scaling factor.
     * @return the scaled value.
     * @throws IllegalArgumentException when {@code factor} is NaN.
     */
    public RelativeDuration multiply(double factor) {
        if (Double.isNaN(factor)) {
            throw new IllegalArgumentException("factor must not be NaN");
        }
        if (factor <= 0.0) {
            return ZERO;
        }
        if (isPerpetual() || Double.isInfinite(factor)) {
            return POSITIVE_INFINITY;
        }
        if (relativity == RelativeDurationType.ABSOLUTE) {
            return of(duration.multiply(factor));
        }
        return proportionOf(relativity, proportion.multiply(BigDecimal.valueOf(factor)));
    }

    /**
     * Divides this value.
     *
     * <p>Division by zero, or of a perpetual value, gives {@link #POSITIVE_INFINITY}; negative and
     * infinite divisors give {@link #ZERO}.</p>
     *
     * @param divisor divisor.
     * @return the scaled value.
     * @throws IllegalArgumentException when {@code divisor} is NaN.
     */
    public RelativeDuration divide(double divisor) {
        if (Double.isNaN(divisor)) {
            throw new IllegalArgumentException("divisor must not be NaN");
        }
        if (isZero()) {
            return ZERO;
        }
        if (isPerpetual() || divisor == 0.0) {
            return POSITIVE_INFINITY;
        }
        if (divisor < 0.0 || Double.isInfinite(divisor)) {
            return ZERO;
        }
        if (relativity == RelativeDurationType.ABSOLUTE) {
            return of(duration.divide(divisor));
        }
        return proportionOf(relativity, proportion.divide(BigDecimal.valueOf(divisor), MathContext.DECIMAL128));
    }

    public String format(String pattern) {
        return format(pattern, DurationFormatSymbols.invariant());
    }

    /**
     * Formats absolute values with the duration pattern and proportions as {@code Dx}/{@code Yx}.
     */
    public String format(String pattern, DurationFormatSymbols symbols) {
        switch (relativity) {
            case PROPORTION_OF_DAY:
                return DAY_PREFIX + proportion.toPlainString();
            case PROPORTION_OF_YEAR:
                return YEAR_PREFIX + proportion.toPlainString();
            case ABSOLUTE:
            default:
                return duration.format(pattern, symbols);
        }
    }

    @Override
    public String toString() {
        return format(null);
    }

    /**
     * Reads the {@code Dx}/{@code Yx} form, falling back to the auto-detecting duration parser.
     *
     * @throws DurationFormatException when the text matches neither form.
     */
    public static RelativeDuration parse(String text) {
        return parse(text, DurationFormatSymbols.invariant());
    }

    public static RelativeDuration parse(String text, DurationFormatSymbols symbols) {
        RelativeDuration proportion = parseProportion(text);
        return proportion != null ? proportion : of(Duration.parse(text, symbols));
    }

    /**
     * Reads the {@code Dx}/{@code Yx} form, falling back to the duration parser for {@code pattern}.
     *
     * @throws DurationFormatException when the text matches neither form.
     */
    public static RelativeDuration parseExact(String text, String pattern) {
        return parseExact(text, pattern, DurationFormatSymbols.invariant());
    }

    public static RelativeDuration parseExact(String text, String pattern, DurationFormatSymbols symbols) {
        RelativeDuration proportion = parseProportion(text);
        return proportion != null ? proportion : of(Duration.parseExact(text, pattern, symbols));
    }

    public static Optional<RelativeDuration> tryParse(String text) {
        try {
            return Optional.of(parse(text));
        } catch (DurationFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Returns the proportion form of {@code text}, or {@code null} when it lacks a prefix.
     */
    private static RelativeDuration parseProportion(String text) {
        if (text == null) {
            return null;
        }
        boolean day = text.startsWith(DAY_PREFIX);
        if (!day && !text.startsWith(YEAR_PREFIX)) {
            return null;
        }
        String number = text.substring(DAY_PREFIX.length());
        BigDecimal proportion;
        try {
            proportion = new BigDecimal(number);
        } catch (NumberFormatException e) {
            throw new DurationFormatException(
                    DurationFormatException.REASON_MALFORMED_NUMBER,
                    "malformed proportion '" + number + "' in '" + text + "'",
                    e
            );
        }
        return day ? fromProportionOfDay(proportion) : fromProportionOfYear(proportion);
    }

    private static BigDecimal toDecimal(double proportion) {
        if (Double.isNaN(proportion) || Double.isInfinite(proportion)) {
            throw new IllegalArgumentException("proportion must be finite, got " + proportion);
        }
        return BigDecimal.valueOf(proportion);
    }
}
