package io.asyncly.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.asyncly.core.journal.JournalEntry;
import java.io.IOException;
import java.io.Serial;
import java.util.Optional;

/// Deserializes the `JournalEntry` sealed hierarchy using a `"type"` discriminator field.
///
/// Handles three subtypes:
/// - **`"choice"`**: `Choice` with its `side`
/// - **`"recorded"`**: `Recorded` whose value is restored with the types named by its
///   type ids; only types allowed by the configured validator are resolved
/// - **`"paused"`**: `Paused`
///
/// @implNote Package-private. Registered by {@link AsynclyJacksonModule}.
/// @see JournalEntrySerializer for the inverse operation
class JournalEntryDeserializer extends StdDeserializer<JournalEntry> {

    @Serial private static final long serialVersionUID = -1427385930288615127L;

    private final transient RecordedValueCodec values;

    JournalEntryDeserializer(RecordedValueCodec values) {
        super(JournalEntry.class);
        this.values = values;
    }

    /// Reads the `"type"` field and dispatches to the matching entry constructor.
    ///
    /// @throws IOException if the type is missing or unknown, or a recorded value names a
    ///     type that is unknown or not allowed
    @Override
    public JournalEntry deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null) {
            throw new IOException("Journal entry without type: " + root);
        }
        String type = typeNode.asText();

        return switch (type) {
            case "choice" -> JournalEntry.choice(readSide(root));
            case "recorded" -> JournalEntry.recorded(readValue(root));
            case "paused" -> JournalEntry.paused();
            default -> throw new IOException("Unknown JournalEntry type: " + type);
        };
    }

    private static JournalEntry.Side readSide(JsonNode root) throws IOException {
        JsonNode side = root.get("side");
        if (side == null) {
            throw new IOException("Choice entry without side");
        }
        try {
            return JournalEntry.Side.valueOf(side.asText());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown choice side: " + side.asText(), e);
        }
    }

    private Object readValue(JsonNode root) throws IOException {
        JsonNode value = root.get("value");
        Object content = value == null || value.isNull() ? null : values.read(value);
        if (root.path("optional").asBoolean(false)) {
            return Optional.ofNullable(content);
        }
        return content;
    }
}
