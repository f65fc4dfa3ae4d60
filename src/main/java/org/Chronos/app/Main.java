package org.Chronos.app;

import org.Chronos.core.duration.Duration;
import org.Chronos.core.format.DurationFormatException;
import org.Chronos.core.format.StandardPattern;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Parses every argument with the auto-detecting parser and prints it under each standard
 * pattern. Without arguments a fixed sample value is shown.</p>
 */
public class Main {
    static final String SAMPLE = "1 2 03:04:05";

    /**
     * Launches the sample CLI routine.
     *
     * @param args duration texts to echo.
     */
    public static void main(String[] args) {
        String[] inputs = args.length == 0 ? new String[]{SAMPLE} : args;
        for (String input : inputs) {
            Duration value;
            try {
                value = Duration.parse(input);
            } catch (DurationFormatException e) {
                System.err.println(input + " -> " + e.getMessage());
                continue;
            }
            System.out.println(input);
            for (StandardPattern pattern : StandardPattern.values()) {
                String letter = String.valueOf(pattern.letter());
                System.out.println("  " + letter + ": " + value.format(letter));
            }
        }
    }
}
