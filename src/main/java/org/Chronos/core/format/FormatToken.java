package org.Chronos.core.format;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * One run of a tokenized custom pattern: either literal text or a unit letter repeated
 * {@code count} times.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FormatToken {
    /** Literal text, {@code null} for unit runs. */
    String literal;
    /** Unit of the run, {@code null} for literal runs. */
    FormatUnit unit;
    /** Number of repeated letters; 0 for literal runs. */
    int count;

    static FormatToken literal(String text) {
        return new FormatToken(Objects.requireNonNull(text, "text"), null, 0);
    }

    static FormatToken unit(FormatUnit unit, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        return new FormatToken(null, Objects.requireNonNull(unit, "unit"), count);
    }

    public boolean isLiteral() {
        return literal != null;
    }
}
