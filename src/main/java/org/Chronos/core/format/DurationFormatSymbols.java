package org.Chronos.core.format;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Culture-dependent symbols used by the duration writer and reader.
 */
@Value
@Builder(toBuilder = true)
public class DurationFormatSymbols {

    private static final DurationFormatSymbols INVARIANT = DurationFormatSymbols.builder().build();

    /**
     * Text of a positive perpetual duration.
     */
    @NonNull
    @Builder.Default
    String positiveInfinitySymbol = "∞";

    /**
     * Text of a negative perpetual duration.
     */
    @NonNull
    @Builder.Default
    String negativeInfinitySymbol = "-∞";

    /**
     * Prefix of negative finite durations.
     */
    @NonNull
    @Builder.Default
    String negativeSign = "-";

    /**
     * Digit grouping separator, skipped by the extensible reader.
     */
    @NonNull
    @Builder.Default
    String groupingSeparator = ",";

    /**
     * Decimal separator, used in scientific notation and by the extensible reader.
     */
    @NonNull
    @Builder.Default
    String decimalSeparator = ".";

    /**
     * Text emitted for an unquoted {@code :} in a custom pattern.
     */
    @NonNull
    @Builder.Default
    String timeSeparator = ":";

    /**
     * Text emitted for an unquoted {@code /} in a custom pattern.
     */
    @NonNull
    @Builder.Default
    String dateSeparator = "/";

    /**
     * Returns culture-independent symbols.
     */
    public static DurationFormatSymbols invariant() {
        return INVARIANT;
    }

    /**
     * Returns symbols taken from the locale's decimal format symbols.
     *
     * <p>The JDK exposes no per-locale time or date separator, so those keep their invariant values.</p>
     *
     * @param locale source locale.
     */
    public static DurationFormatSymbols of(Locale locale) {
        DecimalFormatSymbols decimal = DecimalFormatSymbols.getInstance(locale);
        String minus = String.valueOf(decimal.getMinusSign());
        return DurationFormatSymbols.builder()
                .positiveInfinitySymbol(decimal.getInfinity())
                .negativeInfinitySymbol(minus + decimal.getInfinity())
                .negativeSign(minus)
                .groupingSeparator(String.valueOf(decimal.getGroupingSeparator()))
                .decimalSeparator(String.valueOf(decimal.getDecimalSeparator()))
                .build();
    }
}
