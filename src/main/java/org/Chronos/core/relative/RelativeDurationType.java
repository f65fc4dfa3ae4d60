package org.Chronos.core.relative;

/**
 * How a {@link RelativeDuration} measures its length.
 */
public enum RelativeDurationType {
    /** A literal duration. */
    ABSOLUTE,
    /** A fraction of a day whose length depends on context. */
    PROPORTION_OF_DAY,
    /** A fraction of a year whose length depends on context. */
    PROPORTION_OF_YEAR
}
