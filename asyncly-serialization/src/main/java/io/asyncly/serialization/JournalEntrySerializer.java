package io.asyncly.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.asyncly.core.journal.JournalEntry;
import java.io.IOException;
import java.io.Serial;
import java.util.Optional;

/// Serializes the `JournalEntry` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`Choice`**: `{"type":"choice","side":"LEFT"}`
/// - **`Recorded`**: `{"type":"recorded","value":3}`, or with a type id for values that
///   need one, e.g. `{"type":"recorded","value":["java.lang.Long",3]}`. The value is
///   omitted for a `null` result. An `Optional` result adds `"optional":true` and writes
///   its content, if any, as the value.
/// - **`Paused`**: `{"type":"paused"}`
///
/// @implNote Package-private. Registered by {@link AsynclyJacksonModule}.
/// @see JournalEntryDeserializer for the inverse operation
class JournalEntrySerializer extends StdSerializer<JournalEntry> {

    @Serial private static final long serialVersionUID = 6618259144029380741L;

    private final transient RecordedValueCodec values;

    JournalEntrySerializer(RecordedValueCodec values) {
        super(JournalEntry.class);
        this.values = values;
    }

    @Override
    public void serialize(JournalEntry entry, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (entry instanceof JournalEntry.Choice choice) {
            gen.writeStringField("type", "choice");
            gen.writeStringField("side", choice.side().name());
        } else if (entry instanceof JournalEntry.Recorded recorded) {
            gen.writeStringField("type", "recorded");
            writeValue(recorded.value(), gen);
        } else {
            gen.writeStringField("type", "paused");
        }

        gen.writeEndObject();
    }

    private void writeValue(Object value, JsonGenerator gen) throws IOException {
        Object content = value;
        if (value instanceof Optional<?> optional) {
            gen.writeBooleanField("optional", true);
            content = optional.orElse(null);
        }
        if (content != null) {
            gen.writeFieldName("value");
            values.write(content, gen);
        }
    }
}
