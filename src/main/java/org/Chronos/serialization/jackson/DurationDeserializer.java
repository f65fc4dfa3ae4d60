package org.Chronos.serialization.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.Chronos.core.duration.Duration;
import org.Chronos.core.duration.DurationOverflowException;
import org.Chronos.core.format.DurationFormatException;
import org.Chronos.core.format.DurationFormatSymbols;

import java.io.IOException;

/**
 * Reads a {@link Duration} from a round-trip string. Any other JSON token is rejected.
 */
public final class DurationDeserializer extends StdDeserializer<Duration> {
    private static final long serialVersionUID = 1L;

    public DurationDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (Duration) ctxt.handleUnexpectedToken(Duration.class, p);
        }
        String text = p.getText();
        try {
            return Duration.parseExact(text, DurationJsonModule.WIRE_PATTERN, DurationFormatSymbols.invariant());
        } catch (DurationFormatException | DurationOverflowException e) {
            throw ctxt.weirdStringException(text, Duration.class, e.getMessage());
        }
    }
}
