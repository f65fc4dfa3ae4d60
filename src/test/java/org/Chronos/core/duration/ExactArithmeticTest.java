package org.Chronos.core.duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Exact Arithmetic Tests")
class ExactArithmeticTest {

    // ========== Add / Subtract Tests ==========

    @ParameterizedTest
    @CsvSource({
            "1, 2, 3",
            "-1, -2, -3",
            "1, -2, -1",
            "-1, 2, 1",
            "2, -2, 0"
    })
    @DisplayName("Signed addition in hours")
    void testAddSigned(long a, long b, long expected) {
        assertEquals(Duration.fromHours(expected), Duration.fromHours(a).add(Duration.fromHours(b)));
    }

    @ParameterizedTest
    @CsvSource({
            "1, 2, -1",
            "2, 1, 1",
            "-1, -2, 1",
            "-2, -1, -1",
            "1, -2, 3",
            "-1, 2, -3",
            "5, 5, 0"
    })
    @DisplayName("Signed subtraction in hours")
    void testSubtractSigned(long a, long b, long expected) {
        assertEquals(Duration.fromHours(expected), Duration.fromHours(a).subtract(Duration.fromHours(b)));
    }

    @Test
    @DisplayName("Borrow ripples from aeons down to Planck time")
    void testBorrowAcrossAllFields() {
        Duration value = Duration.ONE_AEON.subtract(Duration.ONE_PLANCK_TIME);

        assertEquals(null, value.getAeons());
        assertEquals(DurationUnits.YEARS_PER_AEON - 1, value.getYears());
        assertEquals(DurationUnits.NANOSECONDS_PER_YEAR - 1L, value.getTotalNanoseconds());
        assertEquals(DurationUnits.YOCTOSECONDS_PER_NANOSECOND - 1L, value.getTotalYoctoseconds());
        assertEquals(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND.subtract(BigInteger.ONE), value.getPlanckTime());
    }

    @Test
    @DisplayName("Carry ripples from Planck time up to aeons")
    void testCarryAcrossAllFields() {
        Duration almostAeon = Duration.ONE_AEON.subtract(Duration.ONE_PLANCK_TIME);
        assertEquals(Duration.ONE_AEON, almostAeon.add(Duration.ONE_PLANCK_TIME));
        assertEquals(Duration.ONE_AEON.negate(), almostAeon.negate().subtract(Duration.ONE_PLANCK_TIME));
    }

    @ParameterizedTest
    @CsvSource({
            "false, 0, 1, 0, 1, 0, 1",
            "false, 2, 3, 0, 999, 5, 123456789",
            "false, 0, 1, 41, 2, 0, 5391247",
            "true, 0, 1, 0, 1, 0, 1",
            "true, 7, 10000000000, 1, 2, 3, 4"
    })
    @DisplayName("Same-sign addition with carries on every field is commutative and associative")
    void testAddCommutativeAndAssociative(boolean negative,
                                          long aeonsA, long shortfallA,
                                          long aeonsB, long shortfallB,
                                          long aeonsC, long shortfallC) {
        Duration a = justBelowAeons(negative, aeonsA, shortfallA);
        Duration b = justBelowAeons(negative, aeonsB, shortfallB);
        Duration c = justBelowAeons(negative, aeonsC, shortfallC);

        assertEquals(a.add(b), b.add(a));
        assertEquals(a.add(b).add(c), a.add(b.add(c)));

        Duration expected = justBelowAeons(negative, aeonsA + aeonsB + aeonsC + 2L, shortfallA + shortfallB + shortfallC);
        assertEquals(expected, a.add(b).add(c));
    }

    @Test
    @DisplayName("Adding a value to its negation gives zero")
    void testAddInverse() {
        Duration value = Duration.builder()
                .aeons(BigInteger.valueOf(7L))
                .years(3L)
                .seconds(11L)
                .yoctoseconds(5L)
                .planckTime(BigInteger.valueOf(9L))
                .build();
        assertSame(Duration.ZERO, value.add(value.negate()));
        assertSame(Duration.ZERO, value.subtract(value));
    }

    @Test
    @DisplayName("Zero is the identity")
    void testZeroIdentity() {
        Duration value = Duration.fromMinutes(-3L);
        assertEquals(value, value.add(Duration.ZERO));
        assertEquals(value, Duration.ZERO.add(value));
        assertEquals(value.negate(), Duration.ZERO.subtract(value));
    }

    // ========== Perpetual Tests ==========

    @Test
    @DisplayName("Perpetual values absorb finite operands")
    void testPerpetualAbsorbs() {
        assertSame(Duration.POSITIVE_INFINITY, Duration.POSITIVE_INFINITY.add(Duration.ONE_AEON));
        assertSame(Duration.NEGATIVE_INFINITY, Duration.ONE_AEON.add(Duration.NEGATIVE_INFINITY));
        assertSame(Duration.NEGATIVE_INFINITY, Duration.ONE_HOUR.subtract(Duration.POSITIVE_INFINITY));
        assertSame(Duration.POSITIVE_INFINITY, Duration.POSITIVE_INFINITY.subtract(Duration.ONE_HOUR));
    }

    @Test
    @DisplayName("Opposite perpetual values cancel")
    void testPerpetualCancellation() {
        assertSame(Duration.ZERO, Duration.POSITIVE_INFINITY.add(Duration.NEGATIVE_INFINITY));
        assertSame(Duration.ZERO, Duration.POSITIVE_INFINITY.subtract(Duration.POSITIVE_INFINITY));
        assertSame(Duration.POSITIVE_INFINITY, Duration.POSITIVE_INFINITY.add(Duration.POSITIVE_INFINITY));
        assertSame(Duration.POSITIVE_INFINITY, Duration.POSITIVE_INFINITY.subtract(Duration.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("Negate and abs")
    void testNegateAndAbs() {
        assertSame(Duration.NEGATIVE_INFINITY, Duration.POSITIVE_INFINITY.negate());
        assertSame(Duration.ZERO, Duration.ZERO.negate());
        assertEquals(Duration.ONE_DAY, Duration.ONE_DAY.negate().abs());
        assertSame(Duration.ONE_DAY, Duration.ONE_DAY.abs());
        assertSame(Duration.POSITIVE_INFINITY, Duration.NEGATIVE_INFINITY.abs());
    }

    // ========== Comparison Tests ==========

    @Test
    @DisplayName("Ordering across signs, magnitudes and infinities")
    void testTotalOrder() {
        List<Duration> sorted = List.of(
                Duration.NEGATIVE_INFINITY,
                Duration.ONE_AEON.negate(),
                Duration.ONE_YEAR.negate(),
                Duration.ONE_PLANCK_TIME.negate(),
                Duration.ZERO,
                Duration.ONE_PLANCK_TIME,
                Duration.ONE_YOCTOSECOND,
                Duration.ONE_SECOND,
                Duration.ONE_YEAR,
                Duration.ONE_AEON,
                Duration.POSITIVE_INFINITY
        );
        List<Duration> shuffled = new ArrayList<>(sorted);
        Collections.reverse(shuffled);
        Collections.sort(shuffled);
        assertEquals(sorted, shuffled);
    }

    @Test
    @DisplayName("Comparison is antisymmetric")
    void testCompareAntisymmetric() {
        Duration small = Duration.fromMinutes(-5L);
        Duration large = Duration.fromMinutes(-1L);
        assertTrue(small.compareTo(large) < 0);
        assertTrue(large.compareTo(small) > 0);
        assertEquals(0, Duration.POSITIVE_INFINITY.compareTo(Duration.POSITIVE_INFINITY));
        assertTrue(Duration.NEGATIVE_INFINITY.compareTo(Duration.ONE_AEON.negate()) < 0);
        assertTrue(Duration.ONE_AEON.negate().compareTo(Duration.NEGATIVE_INFINITY) > 0);
    }

    @Test
    @DisplayName("Max and min")
    void testMaxMin() {
        assertSame(Duration.ONE_DAY, Duration.max(Duration.ONE_HOUR, Duration.ONE_DAY));
        assertSame(Duration.ONE_HOUR, Duration.min(Duration.ONE_HOUR, Duration.ONE_DAY));
        assertSame(Duration.NEGATIVE_INFINITY, Duration.min(Duration.ZERO, Duration.NEGATIVE_INFINITY));
    }

    /**
     * {@code aeons + 1} aeons less {@code shortfall} Planck times, so every field below aeons sits
     * near its radix and any further addition carries all the way up.
     */
    private static Duration justBelowAeons(boolean negative, long aeons, long shortfall) {
        Duration magnitude = Duration.fromAeons(BigInteger.valueOf(aeons + 1L))
                .subtract(Duration.fromPlanckTime(BigInteger.valueOf(shortfall)));
        return negative ? magnitude.negate() : magnitude;
    }
}
