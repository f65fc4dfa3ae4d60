package org.Chronos.core.duration;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Units a duration can be built from, each mapped onto the stored field it lands in.
 */
@Getter
@Accessors(fluent = true)
public enum DurationUnit {
    AEON(RadixField.AEONS, 1L),
    YEAR(RadixField.YEARS, 1L),
    DAY(RadixField.NANOSECONDS, DurationUnits.NANOSECONDS_PER_DAY),
    HOUR(RadixField.NANOSECONDS, DurationUnits.NANOSECONDS_PER_HOUR),
    MINUTE(RadixField.NANOSECONDS, DurationUnits.NANOSECONDS_PER_MINUTE),
    SECOND(RadixField.NANOSECONDS, DurationUnits.NANOSECONDS_PER_SECOND),
    MILLISECOND(RadixField.NANOSECONDS, DurationUnits.NANOSECONDS_PER_MILLISECOND),
    MICROSECOND(RadixField.NANOSECONDS, DurationUnits.NANOSECONDS_PER_MICROSECOND),
    NANOSECOND(RadixField.NANOSECONDS, 1L),
    PICOSECOND(RadixField.YOCTOSECONDS, DurationUnits.YOCTOSECONDS_PER_PICOSECOND),
    FEMTOSECOND(RadixField.YOCTOSECONDS, DurationUnits.YOCTOSECONDS_PER_FEMTOSECOND),
    ATTOSECOND(RadixField.YOCTOSECONDS, DurationUnits.YOCTOSECONDS_PER_ATTOSECOND),
    ZEPTOSECOND(RadixField.YOCTOSECONDS, DurationUnits.YOCTOSECONDS_PER_ZEPTOSECOND),
    YOCTOSECOND(RadixField.YOCTOSECONDS, 1L),
    PLANCK_TIME(RadixField.PLANCK_TIME, 1L);

    /** Stored field one unit of this kind is expressed in. */
    private final RadixField field;
    /** Number of {@link #field} units in one unit of this kind. */
    private final BigInteger unitsInField;
    private final BigDecimal unitsInFieldDecimal;

    DurationUnit(RadixField field, long unitsInField) {
        this.field = field;
        this.unitsInField = BigInteger.valueOf(unitsInField);
        this.unitsInFieldDecimal = BigDecimal.valueOf(unitsInField);
    }
}
