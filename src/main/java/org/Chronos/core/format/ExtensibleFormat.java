package org.Chronos.core.format;

import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;
import org.Chronos.core.duration.Duration;
import org.Chronos.core.duration.DurationAccumulator;
import org.Chronos.core.duration.DurationUnit;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.StringJoiner;

/**
 * The {@code X} pattern: every non-zero unit as {@code <value> <symbol>}, space separated, for example
 * {@code 1 y 2 d 3 h 4 min}.
 *
 * <p>The reader accepts values with grouping separators, a decimal part or a scientific exponent,
 * and a negative sign anywhere in the text.</p>
 */
@UtilityClass
class ExtensibleFormat {

    private static final Object2ObjectMap<String, DurationUnit> UNITS_BY_SYMBOL = new Object2ObjectOpenHashMap<>();

    static {
        UNITS_BY_SYMBOL.put("y", DurationUnit.YEAR);
        UNITS_BY_SYMBOL.put("a", DurationUnit.YEAR);
        UNITS_BY_SYMBOL.put("d", DurationUnit.DAY);
        UNITS_BY_SYMBOL.put("h", DurationUnit.HOUR);
        UNITS_BY_SYMBOL.put("min", DurationUnit.MINUTE);
        UNITS_BY_SYMBOL.put("s", DurationUnit.SECOND);
        UNITS_BY_SYMBOL.put("ms", DurationUnit.MILLISECOND);
        UNITS_BY_SYMBOL.put("μs", DurationUnit.MICROSECOND);
        UNITS_BY_SYMBOL.put("us", DurationUnit.MICROSECOND);
        UNITS_BY_SYMBOL.put("ns", DurationUnit.NANOSECOND);
        UNITS_BY_SYMBOL.put("ps", DurationUnit.PICOSECOND);
        UNITS_BY_SYMBOL.put("fs", DurationUnit.FEMTOSECOND);
        UNITS_BY_SYMBOL.put("as", DurationUnit.ATTOSECOND);
        UNITS_BY_SYMBOL.put("zs", DurationUnit.ZEPTOSECOND);
        UNITS_BY_SYMBOL.put("ys", DurationUnit.YOCTOSECOND);
        UNITS_BY_SYMBOL.put("tP", DurationUnit.PLANCK_TIME);
    }

    String write(Duration value, DurationFormatSymbols symbols) {
        if (value.isPerpetual()) {
            return value.isNegative() ? symbols.getNegativeInfinitySymbol() : symbols.getPositiveInfinitySymbol();
        }
        if (value.isZero()) {
            return "0";
        }
        StringJoiner joiner = new StringJoiner(" ");
        BigInteger totalYears = value.getTotalYears();
        if (totalYears.signum() > 0) {
            joiner.add(totalYears + " y");
        }
        appendNonZero(joiner, value.getDays(), "d");
        appendNonZero(joiner, value.getHours(), "h");
        appendNonZero(joiner, value.getMinutes(), "min");
        appendNonZero(joiner, value.getSeconds(), "s");
        appendNonZero(joiner, value.getMilliseconds(), "ms");
        appendNonZero(joiner, value.getMicroseconds(), "μs");
        appendNonZero(joiner, value.getNanoseconds(), "ns");
        appendNonZero(joiner, value.getPicoseconds(), "ps");
        appendNonZero(joiner, value.getFemtoseconds(), "fs");
        appendNonZero(joiner, value.getAttoseconds(), "as");
        appendNonZero(joiner, value.getZeptoseconds(), "zs");
        appendNonZero(joiner, value.getYoctoseconds(), "ys");
        if (value.getPlanckTime() != null) {
            joiner.add(value.getPlanckTime() + " tP");
        }
        String text = joiner.toString();
        return value.isNegative() ? symbols.getNegativeSign() + text : text;
    }

    Duration read(String input, DurationFormatSymbols symbols) {
        Scan scan = new Scan(input, symbols);
        ObjectArrayList<Segment> segments = scan.segments;
        if (segments.size() == 1 && segments.get(0).numeric && "0".equals(segments.get(0).text)) {
            return Duration.ZERO;
        }
        if (segments.isEmpty()) {
            throw mismatch(input, "no values found");
        }

        DurationAccumulator accumulator = new DurationAccumulator().negative(scan.negative);
        for (int i = 0; i < segments.size(); i += 2) {
            Segment number = segments.get(i);
            if (!number.numeric) {
                throw mismatch(input, "unit symbol '" + number.text + "' has no value");
            }
            if (i + 1 >= segments.size() || segments.get(i + 1).numeric) {
                throw mismatch(input, "value '" + number.text + "' has no unit symbol");
            }
            String symbol = segments.get(i + 1).text;
            DurationUnit unit = UNITS_BY_SYMBOL.get(symbol);
            if (unit == null) {
                throw new DurationFormatException(
                        DurationFormatException.REASON_UNKNOWN_UNIT_SYMBOL,
                        "unknown unit symbol '" + symbol + "' in '" + input + "'"
                );
            }
            accumulator.add(unit, parseAmount(number.text, input));
        }
        return accumulator.toDuration();
    }

    private BigDecimal parseAmount(String text, String input) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new DurationFormatException(
                    DurationFormatException.REASON_MALFORMED_NUMBER,
                    "malformed number '" + text + "' in '" + input + "'",
                    e
            );
        }
    }

    private DurationFormatException mismatch(String input, String detail) {
        return new DurationFormatException(
                DurationFormatException.REASON_PATTERN_MISMATCH,
                "'" + input + "' does not match pattern X: " + detail
        );
    }

    private void appendNonZero(StringJoiner joiner, long amount, String symbol) {
        if (amount > 0L) {
            joiner.add(amount + " " + symbol);
        }
    }

    private static final class Segment {
        private final String text;
        private final boolean numeric;

        Segment(String text, boolean numeric) {
            this.text = text;
            this.numeric = numeric;
        }
    }

    /**
     * Splits the input into alternating numeric and symbol segments. Whitespace separates segments,
     * grouping separators inside numbers are dropped and a negative sign anywhere marks the value
     * negative.
     */
    private static final class Scan {
        private final ObjectArrayList<Segment> segments = new ObjectArrayList<>();
        private final StringBuilder current = new StringBuilder();
        private boolean numeric;
        private boolean negative;

        Scan(String input, DurationFormatSymbols symbols) {
            int i = 0;
            while (i < input.length()) {
                char ch = input.charAt(i);
                if (ch >= '0' && ch <= '9') {
                    if (!numeric) {
                        flush();
                        numeric = true;
                    }
                    current.append(ch);
                    i++;
                    continue;
                }
                if (input.startsWith(symbols.getNegativeSign(), i)) {
                    negative = true;
                    i += symbols.getNegativeSign().length();
                    continue;
                }
                if (numeric) {
                    if (input.startsWith(symbols.getGroupingSeparator(), i)) {
                        i += symbols.getGroupingSeparator().length();
                        continue;
                    }
                    if (input.startsWith(symbols.getDecimalSeparator(), i)) {
                        current.append('.');
                        i += symbols.getDecimalSeparator().length();
                        continue;
                    }
                    if (isExponent(input, i)) {
                        current.append('E').append(input.charAt(i + 1));
                        i += 2;
                        continue;
                    }
                    flush();
                    numeric = false;
                }
                if (Character.isWhitespace(ch)) {
                    flush();
                } else {
                    current.append(ch);
                }
                i++;
            }
            flush();
        }

        private static boolean isExponent(String input, int i) {
            char ch = input.charAt(i);
            return (ch == 'e' || ch == 'E')
                    && i + 2 < input.length()
                    && (input.charAt(i + 1) == '+' || input.charAt(i + 1) == '-')
                    && Character.isDigit(input.charAt(i + 2));
        }

        private void flush() {
            if (current.length() > 0) {
                segments.add(new Segment(current.toString(), numeric));
                current.setLength(0);
            }
        }
    }
}
