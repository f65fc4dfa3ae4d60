package org.Chronos.core.format;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Splits a custom pattern into literal and unit runs. Writer and reader share the result, so
 * both interpret a pattern identically.
 *
 * <ul>
 *     <li>consecutive letters of the same unit form one run whose count is the run length;</li>
 *     <li>{@code :} and {@code /} become the time and date separators of the symbols;</li>
 *     <li>{@code '...'} and {@code "..."} quote literal text, {@code \} escapes one character;</li>
 *     <li>{@code %} ends the current run and reads the next character as a unit letter;</li>
 *     <li>anything else is literal.</li>
 * </ul>
 *
 * <p>Adjacent literal characters are merged into a single literal token.</p>
 */
@UtilityClass
public class PatternTokenizer {

    public ObjectList<FormatToken> tokenize(String pattern, DurationFormatSymbols symbols) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(symbols, "symbols");
        Run run = new Run();
        boolean singleQuote = false;
        boolean doubleQuote = false;
        boolean escaped = false;
        boolean forced = false;

        for (int i = 0; i < pattern.length(); i++) {
            char ch = pattern.charAt(i);
            if (forced) {
                forced = false;
                FormatUnit unit = FormatUnit.forLetter(ch);
                if (unit != null) {
                    run.startUnit(unit);
                } else {
                    run.appendLiteral(String.valueOf(ch));
                }
                continue;
            }
            if (escaped) {
                escaped = false;
                run.appendLiteral(String.valueOf(ch));
                continue;
            }
            if (singleQuote) {
                if (ch == '\'') {
                    singleQuote = false;
                } else {
                    run.appendLiteral(String.valueOf(ch));
                }
                continue;
            }
            if (doubleQuote) {
                if (ch == '"') {
                    doubleQuote = false;
                } else {
                    run.appendLiteral(String.valueOf(ch));
                }
                continue;
            }
            switch (ch) {
                case '\'':
                    run.finishUnit();
                    singleQuote = true;
                    break;
                case '"':
                    run.finishUnit();
                    doubleQuote = true;
                    break;
                case '\\':
                    run.finishUnit();
                    escaped = true;
                    break;
                case '%':
                    run.finishUnit();
                    forced = true;
                    break;
                case ':':
                    run.appendLiteral(symbols.getTimeSeparator());
                    break;
                case '/':
                    run.appendLiteral(symbols.getDateSeparator());
                    break;
                default:
                    FormatUnit unit = FormatUnit.forLetter(ch);
                    if (unit == null) {
                        run.appendLiteral(String.valueOf(ch));
                    } else {
                        run.continueOrStartUnit(unit);
                    }
                    break;
            }
        }
        return run.finish();
    }

    /**
     * Token list under construction plus the open literal or unit run.
     */
    private static final class Run {
        private final ObjectArrayList<FormatToken> tokens = new ObjectArrayList<>();
        private final StringBuilder literal = new StringBuilder();
        private FormatUnit unit;
        private int count;

        void appendLiteral(String text) {
            finishUnit();
            literal.append(text);
        }

        void continueOrStartUnit(FormatUnit next) {
            if (next == unit) {
                count++;
            } else {
                startUnit(next);
            }
        }

        void startUnit(FormatUnit next) {
            finishUnit();
            flushLiteral();
            unit = next;
            count = 1;
        }

        void finishUnit() {
            if (unit != null) {
                tokens.add(FormatToken.unit(unit, count));
                unit = null;
                count = 0;
            }
        }

        ObjectList<FormatToken> finish() {
            finishUnit();
            flushLiteral();
            return tokens;
        }

        private void flushLiteral() {
            if (literal.length() > 0) {
                tokens.add(FormatToken.literal(literal.toString()));
                literal.setLength(0);
            }
        }
    }
}
