package org.Chronos.serialization.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.Chronos.core.relative.RelativeDuration;

import java.io.IOException;

/**
 * Writes a {@link RelativeDuration} as a round-trip or proportion string.
 */
public final class RelativeDurationSerializer extends StdSerializer<RelativeDuration> {
    private static final long serialVersionUID = 1L;

    public RelativeDurationSerializer() {
        super(RelativeDuration.class);
    }

    @Override
    public void serialize(RelativeDuration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.format(DurationJsonModule.WIRE_PATTERN));
    }
}
