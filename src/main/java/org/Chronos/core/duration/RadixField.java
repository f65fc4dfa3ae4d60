package org.Chronos.core.duration;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.math.BigInteger;

/**
 * The five stored magnitude fields, most significant first.
 *
 * <p>Each field carries the number of units of the next field that make up one of its own
 * units. The last field has no finer neighbour.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum RadixField {
    AEONS(DurationUnits.YEARS_PER_AEON_BIG),
    YEARS(DurationUnits.NANOSECONDS_PER_YEAR_BIG),
    NANOSECONDS(DurationUnits.YOCTOSECONDS_PER_NANOSECOND_BIG),
    YOCTOSECONDS(DurationUnits.PLANCK_TIME_PER_YOCTOSECOND),
    PLANCK_TIME(null);

    /** Units of the next finer field per unit of this one, or {@code null} for Planck time. */
    private final BigInteger subdivisions;

    /**
     * Returns the field one step finer, or {@code null} for Planck time.
     */
    public RadixField finer() {
        int next = ordinal() + 1;
        return next < values().length ? values()[next] : null;
    }
}
