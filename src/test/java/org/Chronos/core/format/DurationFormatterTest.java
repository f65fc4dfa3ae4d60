package org.Chronos.core.format;

import org.Chronos.core.duration.Duration;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("DurationFormatter Tests")
class DurationFormatterTest {

    /** 1 y 2 d 3 h 4 min 5 s 6 ms 7 us 8 ns 9 ps 10 fs 11 as 12 zs 13 ys 14 tP. */
    private static Duration sample;

    @BeforeAll
    static void buildSample() {
        sample = Duration.builder()
                .years(1L)
                .days(2L)
                .hours(3L)
                .minutes(4L)
                .seconds(5L)
                .milliseconds(6L)
                .microseconds(7L)
                .nanoseconds(8L)
                .picoseconds(9L)
                .femtoseconds(10L)
                .attoseconds(11L)
                .zeptoseconds(12L)
                .yoctoseconds(13L)
                .planckTime(BigInteger.valueOf(14L))
                .build();
    }

    // ========== Standard Pattern Tests ==========

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "G | 1 2 03:04:05",
            "g | 1 2 03:04",
            "F | 1 2 03:04:05",
            "f | 1 2 03:04",
            "D | 1 2",
            "d | 1 2",
            "T | 03:04:05",
            "t | 03:04",
            "o | 1-183845006007008:9010011012013:14",
            "O | 1-183845006007008:9010011012013:14",
            "E | 1 2 03:04:05:006:007:008:009:010:011:012:013:14",
            "X | 1 y 2 d 3 h 4 min 5 s 6 ms 7 μs 8 ns 9 ps 10 fs 11 as 12 zs 13 ys 14 tP"
    })
    @DisplayName("Every standard pattern renders the sample value")
    void testStandardPatterns(String pattern, String expected) {
        assertEquals(expected, sample.format(pattern));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "G | 0 0 00:00:00",
            "t | 00:00",
            "o | 0-0:0:0",
            "X | 0"
    })
    @DisplayName("Zero under standard patterns")
    void testZero(String pattern, String expected) {
        assertEquals(expected, Duration.ZERO.format(pattern));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "Q"})
    @DisplayName("Missing, blank and unknown single letters fall back to G")
    void testFallbackToGeneral(String pattern) {
        assertEquals("1 2 03:04:05", sample.format(pattern));
    }

    @Test
    @DisplayName("Perpetual values render as infinity symbols under any pattern")
    void testPerpetual() {
        assertEquals("∞", Duration.POSITIVE_INFINITY.format("X"));
        assertEquals("-∞", Duration.NEGATIVE_INFINITY.format("G"));
        assertEquals("-∞", Duration.NEGATIVE_INFINITY.format("HH:mm"));

        DurationFormatSymbols symbols = DurationFormatSymbols.builder()
                .positiveInfinitySymbol("forever")
                .build();
        assertEquals("forever", Duration.POSITIVE_INFINITY.format("o", symbols));
    }

    @Test
    @DisplayName("Negative values are prefixed with the negative sign")
    void testNegativePrefix() {
        assertEquals("-01:00", Duration.fromHours(-1L).format("t"));
        assertEquals("-1 h", Duration.fromHours(-1L).format("X"));
        assertEquals("-0-3600000000000:0:0", Duration.fromHours(-1L).format("o"));

        DurationFormatSymbols symbols = DurationFormatSymbols.builder().negativeSign("~").build();
        assertEquals("~01:00", Duration.fromHours(-1L).format("t", symbols));
    }

    // ========== Custom Pattern Tests ==========

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "%d | 2",
            "dd.hh | 02.03",
            "s.FFFFFF | 5.006007",
            "s.FFFFFFFFFFFFFFFFFFFFFFFF | 5.006007008009010011012013",
            "%n | 183845006007008",
            "d n | 2 8",
            "%Y | 9010011012013",
            "p Y | 9 13",
            "MMMM | 0006"
    })
    @DisplayName("Custom patterns")
    void testCustomPatterns(String pattern, String expected) {
        assertEquals(expected, sample.format(pattern));
    }

    @Test
    @DisplayName("Quoted and escaped letters are literal text")
    void testQuotedLiterals() {
        assertEquals("days: 2", sample.format("'days: 'd"));
        assertEquals("days 2", sample.format("\"days\" d"));
        assertEquals("d 2", sample.format("\\d d"));
    }

    @Test
    @DisplayName("A single unit letter needs a percent prefix to escape the standard patterns")
    void testPercentPrefix() {
        assertEquals("1 2", sample.format("d"));
        assertEquals("2", sample.format("%d"));
        assertEquals("3", sample.format("%h"));
    }

    @Test
    @DisplayName("Total years include aeons; years after total years print zero")
    void testTotalYears() {
        Duration value = Duration.ONE_AEON.add(Duration.fromYears(5L));
        assertEquals("1000000005", value.format("%e"));
        assertEquals("5", value.format("%y"));
        assertEquals("1000000005 0", value.format("e y"));
    }

    @Test
    @DisplayName("Repeated big-number letters select significant digits")
    void testSignificantDigits() {
        assertEquals("1.0E+09", Duration.ONE_AEON.format("ee"));
        assertEquals("12", Duration.fromYears(12L).format("eee"));
        assertEquals("1.23E+05", Duration.fromPlanckTime(BigInteger.valueOf(123_456L)).format("PPP"));
    }

    // ========== Symbol Tests ==========

    @Test
    @DisplayName("Time and date separators come from the symbols")
    void testSeparators() {
        DurationFormatSymbols symbols = DurationFormatSymbols.builder()
                .timeSeparator(".")
                .dateSeparator("-")
                .build();
        assertEquals("01.00", Duration.ONE_HOUR.format("t", symbols));
        assertEquals("2/3", sample.format("d/H"));
        assertEquals("2-3", sample.format("d/H", symbols));
        assertEquals("2:3", sample.format("d':'H", symbols));
    }

    @Test
    @DisplayName("Locale symbols drive the decimal separator")
    void testLocaleSymbols() {
        assertEquals("1,2E+05", Duration.fromYears(123_456L).format("ee", Locale.GERMANY));
        assertEquals("1.2E+05", Duration.fromYears(123_456L).format("ee", Locale.US));
    }
}
