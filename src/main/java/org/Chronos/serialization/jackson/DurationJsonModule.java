package org.Chronos.serialization.jackson;

import com.fasterxml.jackson.databind.module.SimpleModule;
import org.Chronos.core.duration.Duration;
import org.Chronos.core.relative.RelativeDuration;

/**
 * Jackson module that writes {@link Duration} and {@link RelativeDuration} as JSON strings in the
 * lossless round-trip pattern {@code o}.
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new DurationJsonModule());
 * }</pre>
 */
public final class DurationJsonModule extends SimpleModule {
    private static final long serialVersionUID = 1L;

    /** Pattern used on the wire. */
    public static final String WIRE_PATTERN = "o";

    public DurationJsonModule() {
        super("ChronosDurationModule");
        addSerializer(Duration.class, new DurationSerializer());
        addDeserializer(Duration.class, new DurationDeserializer());
        addSerializer(RelativeDuration.class, new RelativeDurationSerializer());
        addDeserializer(RelativeDuration.class, new RelativeDurationDeserializer());
    }
}
