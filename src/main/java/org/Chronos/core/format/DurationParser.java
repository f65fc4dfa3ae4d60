package org.Chronos.core.format;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Chronos.core.duration.Duration;
import org.Chronos.core.duration.DurationAccumulator;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads durations written by {@link DurationFormatter}.
 *
 * <p>Infinity symbols are recognized before any pattern. Values fold through a
 * {@link DurationAccumulator}, so every result is canonical even when a field was written out of
 * range (for example {@code 90} minutes). Values too large to represent raise
 * {@link org.Chronos.core.duration.DurationOverflowException} rather than a format failure.</p>
 */
@Slf4j
@UtilityClass
public class DurationParser {

    /**
     * Parses {@code text} by trying every standard pattern in {@link StandardPattern#PARSE_ORDER}.
     *
     * @param text input text.
     * @param symbols culture symbols.
     * @return the first successful result.
     * @throws DurationFormatException when no standard pattern matches.
     */
    public Duration parse(String text, DurationFormatSymbols symbols) {
        Objects.requireNonNull(symbols, "symbols");
        requireText(text);
        Duration infinity = infinity(text, symbols);
        if (infinity != null) {
            return infinity;
        }
        for (StandardPattern pattern : StandardPattern.PARSE_ORDER) {
            try {
                return parseStandard(text, pattern, symbols);
            } catch (DurationFormatException e) {
                log.debug("'{}' does not match standard pattern {}: {}", text, pattern.letter(), e.getMessage());
            }
        }
        throw new DurationFormatException(
                DurationFormatException.REASON_PATTERN_MISMATCH,
                "'" + text + "' does not match any standard duration pattern"
        );
    }

    /**
     * Like {@link #parse} but reports failure as an empty result.
     */
    public Optional<Duration> tryParse(String text, DurationFormatSymbols symbols) {
        try {
            return Optional.of(parse(text, symbols));
        } catch (DurationFormatException e) {
            log.debug("Rejected duration text: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses {@code text} under exactly one pattern.
     *
     * @param text input text.
     * @param pattern single-letter standard pattern or custom pattern; {@code null} or blank selects
     *                {@code G}.
     * @param symbols culture symbols.
     * @return the parsed duration.
     * @throws DurationFormatException when the text does not match.
     */
    public Duration parseExact(String text, String pattern, DurationFormatSymbols symbols) {
        Objects.requireNonNull(symbols, "symbols");
        requireText(text);
        Duration infinity = infinity(text, symbols);
        if (infinity != null) {
            return infinity;
        }
        StandardPattern standard = StandardPattern.resolve(pattern);
        if (standard != null) {
            return parseStandard(text, standard, symbols);
        }
        return parseCustom(text, pattern, PatternTokenizer.tokenize(pattern, symbols), symbols);
    }

    /**
     * Like {@link #parseExact} but reports failure as an empty result.
     */
    public Optional<Duration> tryParseExact(String text, String pattern, DurationFormatSymbols symbols) {
        try {
            return Optional.of(parseExact(text, pattern, symbols));
        } catch (DurationFormatException e) {
            log.debug("Rejected duration text for pattern '{}': {}", pattern, e.getMessage());
            return Optional.empty();
        }
    }

    private Duration parseStandard(String text, StandardPattern pattern, DurationFormatSymbols symbols) {
        if (pattern.isExtensible()) {
            return ExtensibleFormat.read(text, symbols);
        }
        String custom = pattern.customPattern();
        return parseCustom(text, custom, PatternTokenizer.tokenize(custom, symbols), symbols);
    }

    /**
     * Walks the token list over the input. A unit run ends where the following literal starts, at
     * the end of input for the last token, or after a fixed one or two characters when another unit
     * run follows directly.
     */
    private Duration parseCustom(String text, String pattern, List<FormatToken> tokens, DurationFormatSymbols symbols) {
        String input = text;
        boolean negative = false;
        if (input.startsWith(symbols.getNegativeSign())) {
            negative = true;
            input = input.substring(symbols.getNegativeSign().length());
        }

        DurationAccumulator accumulator = new DurationAccumulator().negative(negative);
        int position = 0;
        for (int i = 0; i < tokens.size(); i++) {
            FormatToken token = tokens.get(i);
            if (token.isLiteral()) {
                if (!input.startsWith(token.getLiteral(), position)) {
                    throw mismatch(text, pattern, "expected '" + token.getLiteral() + "' at offset " + position);
                }
                position += token.getLiteral().length();
                continue;
            }

            int end;
            FormatToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            if (next == null) {
                end = input.length();
            } else if (next.isLiteral()) {
                end = input.indexOf(next.getLiteral(), position);
                if (end < 0) {
                    throw mismatch(text, pattern, "separator '" + next.getLiteral() + "' not found after offset " + position);
                }
            } else if (token.getCount() <= 2) {
                end = position + token.getCount();
                if (end > input.length()) {
                    throw mismatch(text, pattern, "input ends inside a fixed-width field");
                }
            } else {
                throw mismatch(text, pattern, "adjacent unit runs need a separator");
            }

            String slice = input.substring(position, end);
            if (!NumberText.isDigits(slice)) {
                throw new DurationFormatException(
                        DurationFormatException.REASON_MALFORMED_NUMBER,
                        "'" + slice + "' is not a plain number in '" + text + "' for pattern '" + pattern + "'"
                );
            }
            fold(token.getUnit(), slice, accumulator);
            position = end;
        }
        if (position != input.length()) {
            throw mismatch(text, pattern, "unexpected trailing text at offset " + position);
        }
        return accumulator.toDuration();
    }

    private void fold(FormatUnit unit, String digits, DurationAccumulator accumulator) {
        if (unit == FormatUnit.SECOND_FRACTION) {
            FractionalSeconds.fold(digits, accumulator);
            return;
        }
        accumulator.add(unit.durationUnit(), new BigInteger(digits));
    }

    private Duration infinity(String text, DurationFormatSymbols symbols) {
        if (text.equals(symbols.getPositiveInfinitySymbol())) {
            return Duration.POSITIVE_INFINITY;
        }
        if (text.equals(symbols.getNegativeInfinitySymbol())) {
            return Duration.NEGATIVE_INFINITY;
        }
        return null;
    }

    private void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new DurationFormatException(DurationFormatException.REASON_EMPTY_INPUT, "duration text is empty");
        }
    }

    private DurationFormatException mismatch(String text, String pattern, String detail) {
        return new DurationFormatException(
                DurationFormatException.REASON_PATTERN_MISMATCH,
                "'" + text + "' does not match pattern '" + pattern + "': " + detail
        );
    }
}
