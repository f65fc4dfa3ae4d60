package org.Chronos.core.duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DurationAccumulator Tests")
class DurationAccumulatorTest {

    @Test
    @DisplayName("Empty accumulator yields zero")
    void testEmpty() {
        assertSame(Duration.ZERO, new DurationAccumulator().toDuration());
        assertSame(Duration.ZERO, new DurationAccumulator().negative(true).toDuration());
    }

    @Test
    @DisplayName("Mixed whole and fractional amounts fold into one canonical value")
    void testMixedAmounts() {
        Duration value = new DurationAccumulator()
                .add(DurationUnit.HOUR, 1L)
                .add(DurationUnit.MINUTE, new BigDecimal("119.5"))
                .add(DurationUnit.SECOND, BigInteger.valueOf(30L))
                .toDuration();
        assertEquals(Duration.fromHours(3L), value);
    }

    @Test
    @DisplayName("Fractions below one Planck time are truncated")
    void testSubPlanckFractionTruncated() {
        Duration value = new DurationAccumulator()
                .add(DurationUnit.PLANCK_TIME, new BigDecimal("1.999"))
                .toDuration();
        assertEquals(Duration.ONE_PLANCK_TIME, value);
    }

    @Test
    @DisplayName("A fractional yoctosecond lands in the Planck-time field")
    void testFractionalYoctosecond() {
        Duration value = new DurationAccumulator()
                .add(DurationUnit.YOCTOSECOND, new BigDecimal("0.5"))
                .toDuration();
        assertNull(value.getAeons());
        assertEquals(0L, value.getTotalYoctoseconds());
        assertEquals(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND.divide(BigInteger.TWO), value.getPlanckTime());
    }

    @Test
    @DisplayName("Negative amounts are rejected")
    void testNegativeAmountsRejected() {
        DurationAccumulator accumulator = new DurationAccumulator();
        assertThrows(IllegalArgumentException.class, () -> accumulator.add(DurationUnit.DAY, -1L));
        assertThrows(IllegalArgumentException.class, () -> accumulator.add(DurationUnit.DAY, new BigDecimal("-0.1")));
    }

    @Test
    @DisplayName("Radix fields chain from aeons down to Planck time")
    void testRadixChain() {
        assertSame(RadixField.YEARS, RadixField.AEONS.finer());
        assertNull(RadixField.PLANCK_TIME.finer());
        assertEquals(BigInteger.valueOf(DurationUnits.YEARS_PER_AEON), RadixField.AEONS.subdivisions());
        assertEquals(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND, RadixField.YOCTOSECONDS.subdivisions());
        assertNull(RadixField.PLANCK_TIME.subdivisions());
    }

    @Test
    @DisplayName("Overflow exception carries its reason code")
    void testOverflowReasonCode() {
        DurationOverflowException ex = new DurationOverflowException("TEST_REASON", "details");
        assertEquals("TEST_REASON", ex.reasonCode());
        assertTrue(ex.getMessage().contains("[TEST_REASON] details"));
        assertThrows(IllegalArgumentException.class, () -> new DurationOverflowException(" ", "details"));
    }
}
