package org.Chronos.core.format;

import lombok.experimental.UtilityClass;
import org.Chronos.core.duration.Duration;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Renders durations under standard or custom patterns.
 *
 * <p>Perpetual values always render as the infinity symbol of the requested sign. Negative finite
 * values are prefixed with the negative sign.</p>
 */
@UtilityClass
public class DurationFormatter {

    /**
     * Formats {@code value} under {@code pattern}.
     *
     * @param value duration to render.
     * @param pattern single-letter standard pattern, custom pattern, or {@code null} for {@code G}.
     * @param symbols culture symbols.
     * @return formatted text.
     */
    public String format(Duration value, String pattern, DurationFormatSymbols symbols) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(symbols, "symbols");
        if (value.isPerpetual()) {
            return value.isNegative() ? symbols.getNegativeInfinitySymbol() : symbols.getPositiveInfinitySymbol();
        }
        StandardPattern standard = StandardPattern.resolve(pattern);
        if (standard == null) {
            return formatCustom(value, PatternTokenizer.tokenize(pattern, symbols), symbols);
        }
        if (standard.isExtensible()) {
            return ExtensibleFormat.write(value, symbols);
        }
        return formatCustom(value, PatternTokenizer.tokenize(standard.customPattern(), symbols), symbols);
    }

    private String formatCustom(Duration value, List<FormatToken> tokens, DurationFormatSymbols symbols) {
        StringBuilder builder = new StringBuilder();
        if (value.isNegative() && !value.isZero()) {
            builder.append(symbols.getNegativeSign());
        }
        UnitWriter writer = new UnitWriter(value, symbols, builder);
        for (FormatToken token : tokens) {
            if (token.isLiteral()) {
                builder.append(token.getLiteral());
            } else {
                writer.write(token.getUnit(), token.getCount());
            }
        }
        return builder.toString();
    }

    /**
     * Per-call writer state: coarser units already printed switch {@code y}, {@code n} and {@code Y}
     * to remainders.
     */
    private static final class UnitWriter {
        private final Duration value;
        private final DurationFormatSymbols symbols;
        private final StringBuilder builder;
        private boolean totalYearsWritten;
        private boolean nanosecondScopeWritten;
        private boolean yoctosecondScopeWritten;

        UnitWriter(Duration value, DurationFormatSymbols symbols, StringBuilder builder) {
            this.value = value;
            this.symbols = symbols;
            this.builder = builder;
        }

        void write(FormatUnit unit, int count) {
            switch (unit) {
                case TOTAL_YEARS:
                    builder.append(bigNumber(value.getTotalYears(), count));
                    totalYearsWritten = true;
                    break;
                case YEARS:
                    builder.append(NumberText.zeroPad(totalYearsWritten ? 0L : value.getYears(), count));
                    break;
                case DAYS:
                    builder.append(NumberText.zeroPad(value.getDays(), count));
                    break;
                case HOURS:
                    builder.append(NumberText.zeroPad(value.getHours(), count));
                    break;
                case MINUTES:
                    builder.append(NumberText.zeroPad(value.getMinutes(), count));
                    break;
                case SECONDS:
                    builder.append(NumberText.zeroPad(value.getSeconds(), count));
                    break;
                case SECOND_FRACTION:
                    builder.append(FractionalSeconds.digits(value, count));
                    break;
                case MILLISECONDS:
                    builder.append(NumberText.zeroPad(value.getMilliseconds(), count));
                    break;
                case MICROSECONDS:
                    builder.append(NumberText.zeroPad(value.getMicroseconds(), count));
                    break;
                case NANOSECONDS:
                    long nanoseconds = nanosecondScopeWritten ? value.getNanoseconds() : value.getTotalNanoseconds();
                    builder.append(NumberText.zeroPad(nanoseconds, count));
                    break;
                case PICOSECONDS:
                    builder.append(NumberText.zeroPad(value.getPicoseconds(), count));
                    break;
                case FEMTOSECONDS:
                    builder.append(NumberText.zeroPad(value.getFemtoseconds(), count));
                    break;
                case ATTOSECONDS:
                    builder.append(NumberText.zeroPad(value.getAttoseconds(), count));
                    break;
                case ZEPTOSECONDS:
                    builder.append(NumberText.zeroPad(value.getZeptoseconds(), count));
                    break;
                case YOCTOSECONDS:
                    long yoctoseconds = yoctosecondScopeWritten ? value.getYoctoseconds() : value.getTotalYoctoseconds();
                    builder.append(NumberText.zeroPad(yoctoseconds, count));
                    break;
                case PLANCK_TIME:
                    BigInteger planck = value.getPlanckTime() == null ? BigInteger.ZERO : value.getPlanckTime();
                    builder.append(bigNumber(planck, count));
                    break;
                default:
                    throw new IllegalStateException("unhandled format unit " + unit);
            }
            if (unit.scope() == FormatUnit.Scope.NANOSECOND) {
                nanosecondScopeWritten = true;
            } else if (unit.scope() == FormatUnit.Scope.YOCTOSECOND) {
                yoctosecondScopeWritten = true;
            }
        }

        /**
         * One letter prints every digit; more letters select that many significant digits.
         */
        private String bigNumber(BigInteger number, int count) {
            if (count == 1) {
                return number.toString();
            }
            return NumberText.significant(number, count, symbols.getDecimalSeparator());
        }
    }
}
