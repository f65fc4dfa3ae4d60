package org.Chronos.serialization.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.Chronos.core.duration.DurationOverflowException;
import org.Chronos.core.format.DurationFormatException;
import org.Chronos.core.relative.RelativeDuration;

import java.io.IOException;

/**
 * Reads a {@link RelativeDuration} from a {@code Dx}/{@code Yx} proportion or a round-trip string.
 */
public final class RelativeDurationDeserializer extends StdDeserializer<RelativeDuration> {
    private static final long serialVersionUID = 1L;

    public RelativeDurationDeserializer() {
        super(RelativeDuration.class);
    }

    @Override
    public RelativeDuration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (RelativeDuration) ctxt.handleUnexpectedToken(RelativeDuration.class, p);
        }
        String text = p.getText();
        try {
            return RelativeDuration.parseExact(text, DurationJsonModule.WIRE_PATTERN);
        } catch (DurationFormatException | DurationOverflowException e) {
            throw ctxt.weirdStringException(text, RelativeDuration.class, e.getMessage());
        }
    }
}
