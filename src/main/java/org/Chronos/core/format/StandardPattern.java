package org.Chronos.core.format;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * Single-letter patterns and the custom patterns they stand for.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum StandardPattern {
    SHORT_DATE("d", "y d"),
    LONG_DATE("D", "e d"),
    EXTENDED("E", "e d HH:mm:ss:MMM:uuu:nnn:ppp:fff:aaa:zzz:YYY:PPP"),
    FULL_DATE_SHORT_TIME("f", "e d HH:mm"),
    FULL_DATE_LONG_TIME("F", "e d HH:mm:ss"),
    GENERAL_DATE_SHORT_TIME("g", "y d HH:mm"),
    GENERAL_DATE_LONG_TIME("G", "y d HH:mm:ss"),
    /** Lossless; segment widths vary with magnitude, so the text does not sort. */
    ROUND_TRIP("oO", "e'-'n':'Y':'P"),
    SHORT_TIME("t", "HH:mm"),
    LONG_TIME("T", "HH:mm:ss"),
    /** Non-zero units with symbols; not backed by a custom pattern. */
    EXTENSIBLE("X", null);

    /** Order in which the auto-detecting parser tries the standard patterns. */
    public static final List<StandardPattern> PARSE_ORDER = List.of(
            ROUND_TRIP,
            EXTENDED,
            FULL_DATE_LONG_TIME,
            GENERAL_DATE_LONG_TIME,
            FULL_DATE_SHORT_TIME,
            GENERAL_DATE_SHORT_TIME,
            LONG_DATE,
            SHORT_DATE,
            LONG_TIME,
            SHORT_TIME,
            EXTENSIBLE
    );

    private final String letters;
    /** Equivalent custom pattern, {@code null} for {@link #EXTENSIBLE}. */
    private final String customPattern;

    /**
     * Resolves a pattern string to a standard pattern.
     *
     * <p>{@code null}, blank and unknown single letters select {@link #GENERAL_DATE_LONG_TIME};
     * longer patterns are custom and give {@code null}.</p>
     *
     * @param pattern pattern string, nullable.
     * @return the standard pattern, or {@code null} for a custom pattern.
     */
    public static StandardPattern resolve(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return GENERAL_DATE_LONG_TIME;
        }
        if (pattern.length() != 1) {
            return null;
        }
        char letter = pattern.charAt(0);
        for (StandardPattern standard : values()) {
            if (standard.letters.indexOf(letter) >= 0) {
                return standard;
            }
        }
        return GENERAL_DATE_LONG_TIME;
    }

    public boolean isExtensible() {
        return this == EXTENSIBLE;
    }

    /**
     * Returns the letter written in patterns for this standard pattern.
     */
    public char letter() {
        return letters.charAt(0);
    }
}
