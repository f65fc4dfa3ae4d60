package org.Chronos.core.duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Scaled Arithmetic Tests")
class ScaledArithmeticTest {

    // ========== Multiply Tests ==========

    @ParameterizedTest
    @CsvSource({
            "90, 2, 180",
            "90, -2, -180",
            "-90, -2, 180",
            "90, 0, 0"
    })
    @DisplayName("Whole factors scale minutes exactly")
    void testMultiplyWhole(long minutes, long factor, long expected) {
        assertEquals(Duration.fromMinutes(expected), Duration.fromMinutes(minutes).multiply(factor));
    }

    @Test
    @DisplayName("Fractional factors spill into finer fields")
    void testMultiplyFraction() {
        assertEquals(Duration.fromYears(500_000_000L), Duration.ONE_AEON.multiply(new BigDecimal("0.5")));
        assertEquals(Duration.fromHours(12L), Duration.ONE_DAY.multiply(0.5));
        assertEquals(Duration.fromDays(365.25 / 4), Duration.ONE_YEAR.multiply(0.25));
    }

    @Test
    @DisplayName("Multiplying across the whole chain carries into aeons")
    void testMultiplyCarriesIntoAeons() {
        Duration value = Duration.fromYears(2L).multiply((long) DurationUnits.YEARS_PER_AEON);
        assertEquals(Duration.fromAeons(BigInteger.TWO), value);
    }

    @Test
    @DisplayName("Perpetual values stay perpetual under any non-zero factor")
    void testMultiplyPerpetual() {
        assertSame(Duration.NEGATIVE_INFINITY, Duration.POSITIVE_INFINITY.multiply(-3L));
        assertSame(Duration.POSITIVE_INFINITY, Duration.NEGATIVE_INFINITY.multiply(-0.5));
    }

    @Test
    @DisplayName("A zero factor gives zero before any perpetual handling")
    void testMultiplyPerpetualByZero() {
        assertSame(Duration.ZERO, Duration.POSITIVE_INFINITY.multiply(0L));
        assertSame(Duration.ZERO, Duration.NEGATIVE_INFINITY.multiply(0.0));
        assertSame(Duration.ZERO, Duration.POSITIVE_INFINITY.multiply(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Infinite factors give perpetual values and NaN is rejected")
    void testMultiplyDoubleSpecialValues() {
        assertSame(Duration.POSITIVE_INFINITY, Duration.ONE_SECOND.multiply(Double.POSITIVE_INFINITY));
        assertSame(Duration.NEGATIVE_INFINITY, Duration.ONE_SECOND.negate().multiply(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> Duration.ONE_SECOND.multiply(Double.NaN));
    }

    @Test
    @DisplayName("Zero times an infinite factor is perpetual, zero counting as positive")
    void testMultiplyZeroByInfinity() {
        assertSame(Duration.POSITIVE_INFINITY, Duration.ZERO.multiply(Double.POSITIVE_INFINITY));
        assertSame(Duration.NEGATIVE_INFINITY, Duration.ZERO.multiply(Double.NEGATIVE_INFINITY));
    }

    // ========== Divide Tests ==========

    @Test
    @DisplayName("Exact divisors give exact quotients")
    void testDivideExact() {
        assertEquals(Duration.ONE_YEAR, Duration.fromYears(3L).divide(3L));
        assertEquals(Duration.fromHours(12L), Duration.ONE_DAY.divide(2L));
        assertEquals(Duration.fromHours(-12L), Duration.ONE_DAY.divide(-2.0));
        assertEquals(Duration.fromYears(500_000_000L), Duration.ONE_AEON.divide(new BigDecimal("2")));
        assertEquals(Duration.fromSeconds(4L), Duration.ONE_SECOND.divide(new BigDecimal("0.25")));
    }

    @Test
    @DisplayName("Inexact quotients truncate and never exceed the true value")
    void testDivideTruncates() {
        Duration third = Duration.ONE_YEAR.divide(3L);
        assertTrue(third.multiply(3L).compareTo(Duration.ONE_YEAR) <= 0);
        assertTrue(Duration.ONE_YEAR.subtract(third.multiply(3L)).compareTo(Duration.ONE_YOCTOSECOND) < 0);
    }

    @Test
    @DisplayName("Zero divisors give perpetual values with the receiver's sign")
    void testDivideByZero() {
        assertSame(Duration.POSITIVE_INFINITY, Duration.ONE_HOUR.divide(0L));
        assertSame(Duration.NEGATIVE_INFINITY, Duration.ONE_HOUR.negate().divide(0.0));
        assertSame(Duration.ZERO, Duration.ZERO.divide(0L));
    }

    @Test
    @DisplayName("Special divisors")
    void testDivideSpecialValues() {
        assertSame(Duration.ZERO, Duration.ONE_HOUR.divide(Double.POSITIVE_INFINITY));
        assertSame(Duration.NEGATIVE_INFINITY, Duration.POSITIVE_INFINITY.divide(-2L));
        assertThrows(IllegalArgumentException.class, () -> Duration.ONE_HOUR.divide(Double.NaN));
    }

    // ========== Ratio Tests ==========

    @Test
    @DisplayName("Ratio of two durations")
    void testRatio() {
        assertEquals(24.0, Duration.ONE_DAY.divide(Duration.ONE_HOUR), 1.0e-9);
        assertEquals(-0.5, Duration.fromMinutes(-30L).divide(Duration.ONE_HOUR), 1.0e-12);
        assertEquals(0.0, Duration.ZERO.divide(Duration.ONE_HOUR));
        assertTrue(Double.isNaN(Duration.ZERO.divide(Duration.ZERO)));
    }

    @Test
    @DisplayName("Ratio involving infinities or a zero divisor")
    void testRatioSpecialValues() {
        assertEquals(Double.POSITIVE_INFINITY, Duration.ONE_HOUR.divide(Duration.ZERO));
        assertEquals(Double.NEGATIVE_INFINITY, Duration.NEGATIVE_INFINITY.divide(Duration.ONE_HOUR));
        assertEquals(0.0, Duration.ONE_HOUR.divide(Duration.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("Infinite ratios take the dividend's sign only")
    void testRatioInfinityUsesDividendSign() {
        assertEquals(Double.POSITIVE_INFINITY, Duration.POSITIVE_INFINITY.divide(Duration.ONE_HOUR.negate()));
        assertEquals(Double.NEGATIVE_INFINITY, Duration.NEGATIVE_INFINITY.divide(Duration.ONE_HOUR.negate()));
        assertEquals(Double.NEGATIVE_INFINITY, Duration.ONE_HOUR.negate().divide(Duration.ZERO));
    }

    @Test
    @DisplayName("Ratio falls back to coarser units for magnitudes beyond the double range")
    void testRatioFallsBackToCoarserUnit() {
        Duration large = Duration.fromAeons(BigInteger.TEN.pow(300));
        Duration smaller = Duration.fromAeons(BigInteger.TEN.pow(299));
        assertEquals(10.0, large.divide(smaller), 1.0e-9);
    }

    // ========== Modulus Tests ==========

    @ParameterizedTest
    @CsvSource({
            "24, 5, 4",
            "-24, 5, -4",
            "24, -5, 4",
            "4, 5, 4",
            "25, 5, 0"
    })
    @DisplayName("Remainder takes the dividend's sign")
    void testModulus(long hours, long divisorHours, long expected) {
        assertEquals(Duration.fromHours(expected), Duration.fromHours(hours).modulus(Duration.fromHours(divisorHours)));
    }

    @Test
    @DisplayName("Remainder is exact below a yoctosecond")
    void testModulusPlanckPrecision() {
        Duration dividend = Duration.ONE_AEON.add(Duration.fromPlanckTime(BigInteger.valueOf(3L)));
        assertEquals(Duration.fromPlanckTime(BigInteger.valueOf(3L)), dividend.modulus(Duration.ONE_YEAR));
    }

    @Test
    @DisplayName("Modulus edge cases")
    void testModulusEdgeCases() {
        assertSame(Duration.ONE_HOUR, Duration.ONE_HOUR.modulus(Duration.POSITIVE_INFINITY));
        assertSame(Duration.ZERO, Duration.ZERO.modulus(Duration.ONE_HOUR));
    }

    @Test
    @DisplayName("A perpetual dividend leaves a zero remainder")
    void testModulusOfPerpetual() {
        assertSame(Duration.ZERO, Duration.POSITIVE_INFINITY.modulus(Duration.ONE_HOUR));
        assertSame(Duration.ZERO, Duration.NEGATIVE_INFINITY.modulus(Duration.ONE_HOUR));
        assertSame(Duration.ZERO, Duration.POSITIVE_INFINITY.modulus(Duration.NEGATIVE_INFINITY));
        assertSame(Duration.ZERO, Duration.POSITIVE_INFINITY.modulus(Duration.ZERO));
    }

    @Test
    @DisplayName("A zero divisor returns the dividend")
    void testModulusByZero() {
        Duration dividend = Duration.fromMinutes(-90L);
        assertSame(Duration.ONE_HOUR, Duration.ONE_HOUR.modulus(Duration.ZERO));
        assertSame(dividend, dividend.modulus(Duration.ZERO));
    }
}
