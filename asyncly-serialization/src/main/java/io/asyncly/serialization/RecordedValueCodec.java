package io.asyncly.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.util.Objects;

/// Reads and writes the results of recorded effects with their Java types.
///
/// Uses a mapper of its own with {@link RecordedValueTyping}, so the type ids never leak
/// into the rest of the journal JSON.
///
/// @implNote Package-private. Thread-safe once constructed.
final class RecordedValueCodec {

    private final ObjectWriter writer;
    private final ObjectReader reader;

    RecordedValueCodec(PolymorphicTypeValidator allowedTypes) {
        Objects.requireNonNull(allowedTypes, "allowedTypes must not be null");
        ObjectMapper mapper =
                new ObjectMapper()
                        .registerModule(new Jdk8Module())
                        .registerModule(new JavaTimeModule())
                        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setDefaultTyping(RecordedValueTyping.create(allowedTypes));
        this.writer = mapper.writerFor(Object.class);
        this.reader = mapper.readerFor(Object.class);
    }

    void write(Object value, JsonGenerator gen) throws IOException {
        writer.writeValue(gen, value);
    }

    /// @throws IOException if the value names a type the validator does not allow
    Object read(JsonNode node) throws IOException {
        return reader.readValue(node);
    }
}
