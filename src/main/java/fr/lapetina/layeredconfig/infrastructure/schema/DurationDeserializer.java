package fr.lapetina.layeredconfig.infrastructure.schema;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import fr.lapetina.layeredconfig.infrastructure.store.ValueCoercion;

import java.io.IOException;
import java.time.Duration;

/**
 * Reads durations the same way the typed getters do: {@code 1h30m}, {@code 250ms},
 * ISO-8601 {@code PT30S}, or a bare number of nanoseconds.
 */
final class DurationDeserializer extends StdScalarDeserializer<Duration> {

    DurationDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        Object raw;
        if (token == JsonToken.VALUE_NUMBER_INT) {
            raw = parser.getLongValue();
        } else if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            raw = parser.getDoubleValue();
        } else if (token == JsonToken.VALUE_STRING) {
            raw = parser.getText();
        } else {
            return (Duration) context.handleUnexpectedToken(Duration.class, parser);
        }
        Object value = raw;
        return ValueCoercion.toDuration(value)
                .orElseThrow(() -> context.weirdStringException(String.valueOf(value), Duration.class,
                        "not a duration"));
    }
}
