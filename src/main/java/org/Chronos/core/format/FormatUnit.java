package org.Chronos.core.format;

import it.unimi.dsi.fastutil.chars.Char2ObjectMap;
import it.unimi.dsi.fastutil.chars.Char2ObjectOpenHashMap;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Chronos.core.duration.DurationUnit;

/**
 * Unit letters of the custom pattern language.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum FormatUnit {
    /** {@code e}: total years, aeons included. */
    TOTAL_YEARS("e", DurationUnit.YEAR, Scope.NONE),
    /** {@code y}: years within the aeon. */
    YEARS("y", DurationUnit.YEAR, Scope.NONE),
    DAYS("d", DurationUnit.DAY, Scope.NANOSECOND),
    HOURS("hH", DurationUnit.HOUR, Scope.NANOSECOND),
    MINUTES("m", DurationUnit.MINUTE, Scope.NANOSECOND),
    SECONDS("s", DurationUnit.SECOND, Scope.NANOSECOND),
    /** {@code F}: sub-second digits. */
    SECOND_FRACTION("F", null, Scope.NONE),
    MILLISECONDS("M", DurationUnit.MILLISECOND, Scope.NANOSECOND),
    MICROSECONDS("u", DurationUnit.MICROSECOND, Scope.NANOSECOND),
    NANOSECONDS("n", DurationUnit.NANOSECOND, Scope.NONE),
    PICOSECONDS("p", DurationUnit.PICOSECOND, Scope.YOCTOSECOND),
    FEMTOSECONDS("f", DurationUnit.FEMTOSECOND, Scope.YOCTOSECOND),
    ATTOSECONDS("a", DurationUnit.ATTOSECOND, Scope.YOCTOSECOND),
    ZEPTOSECONDS("z", DurationUnit.ZEPTOSECOND, Scope.YOCTOSECOND),
    YOCTOSECONDS("Y", DurationUnit.YOCTOSECOND, Scope.NONE),
    PLANCK_TIME("P", DurationUnit.PLANCK_TIME, Scope.NONE);

    /**
     * Which total field a coarser unit carves up.
     *
     * <p>Once a pattern prints a unit of a scope, later {@code n} or {@code Y} tokens print only the
     * remainder below it instead of the whole field.</p>
     */
    enum Scope {
        NONE,
        NANOSECOND,
        YOCTOSECOND
    }

    private static final Char2ObjectMap<FormatUnit> BY_LETTER = new Char2ObjectOpenHashMap<>();

    static {
        for (FormatUnit unit : values()) {
            for (int i = 0; i < unit.letters.length(); i++) {
                BY_LETTER.put(unit.letters.charAt(i), unit);
            }
        }
    }

    /** Pattern letters selecting this unit. */
    private final String letters;
    /** Unit used to fold a parsed value, {@code null} for the fraction digits. */
    private final DurationUnit durationUnit;
    private final Scope scope;

    /**
     * Resolves a pattern letter.
     *
     * @param letter candidate letter.
     * @return the unit, or {@code null} when {@code letter} is literal text.
     */
    public static FormatUnit forLetter(char letter) {
        return BY_LETTER.get(letter);
    }
}
