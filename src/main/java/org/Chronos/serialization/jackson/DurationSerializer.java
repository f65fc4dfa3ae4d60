package org.Chronos.serialization.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.Chronos.core.duration.Duration;
import org.Chronos.core.format.DurationFormatSymbols;

import java.io.IOException;

/**
 * Writes a {@link Duration} as a round-trip string.
 */
public final class DurationSerializer extends StdSerializer<Duration> {
    private static final long serialVersionUID = 1L;

    public DurationSerializer() {
        super(Duration.class);
    }

    @Override
    public void serialize(Duration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.format(DurationJsonModule.WIRE_PATTERN, DurationFormatSymbols.invariant()));
    }
}
