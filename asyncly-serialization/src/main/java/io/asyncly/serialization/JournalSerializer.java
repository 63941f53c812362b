package io.asyncly.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.asyncly.core.journal.Journal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;

/// Utility class for serializing and deserializing journals to/from JSON.
///
/// A recording run hands back the journals of its paused branches; persisting them
/// as JSON lets a later process resume those branches with
/// {@link io.asyncly.core.journal.Checkpoints#playRecordings}.
///
/// ### Usage
/// {@snippet :
/// // Persist
/// String json = JournalSerializer.recordingsToJson(runtime.runAsynclyRecorded(search));
///
/// // Resume
/// List<Journal> recordings = JournalSerializer.recordingsFromJson(json);
/// runtime.toList(Checkpoints.playRecordings(search, recordings));
/// }
///
/// ### JSON Shape
/// ```
/// {"entries":[
///   {"type":"choice","side":"LEFT"},
///   {"type":"recorded","value":3},
///   {"type":"recorded","value":["java.lang.Long",42]},
///   {"type":"recorded","value":["java.util.ArrayList",[["java.lang.Long",1]]]},
///   {"type":"recorded","optional":true},
///   {"type":"paused"}]}
/// ```
///
/// Integers, strings, doubles and booleans are written bare; every other value carries
/// its class name so it is restored with the same type. Reading resolves only the classes
/// allowed by {@link #recordedValueTypes()}; a journal naming any other class is rejected.
/// Records and other application types must be allowed explicitly:
/// {@snippet :
/// ObjectMapper mapper = JournalSerializer.createMapper(
///         JournalSerializer.recordedValueTypes().allowIfSubType(Quote.class).build());
/// List<Journal> recordings = JournalSerializer.recordingsFromJson(json, mapper);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see AsynclyJacksonModule for the registered type handlers
public final class JournalSerializer {

    private static final TypeReference<List<Journal>> RECORDINGS = new TypeReference<>() {};

    private JournalSerializer() {}

    /// Serializes a journal to pretty-printed JSON.
    ///
    /// @param journal the journal to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Journal journal) {
        try {
            return createMapper().writeValueAsString(journal);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize journal: " + e.getMessage(), e);
        }
    }

    /// Deserializes a journal from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized journal, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Journal fromJson(String json) {
        return fromJson(json, createMapper());
    }

    /// Deserializes a journal from JSON with a caller-configured mapper.
    ///
    /// @param json JSON string, not null
    /// @param mapper mapper from {@link #createMapper(PolymorphicTypeValidator)}, not null
    /// @return deserialized journal, never null
    /// @throws IllegalArgumentException if deserialization fails or a recorded value names
    ///     a type the mapper does not allow
    public static Journal fromJson(String json, ObjectMapper mapper) {
        try {
            return mapper.readValue(json, Journal.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize journal: " + e.getMessage(), e);
        }
    }

    /// Serializes a recording set as a JSON array of journals.
    ///
    /// @param recordings journals returned by a recording run, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String recordingsToJson(List<Journal> recordings) {
        try {
            return createMapper().writerFor(RECORDINGS).writeValueAsString(recordings);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize recordings: " + e.getMessage(), e);
        }
    }

    /// Deserializes a recording set.
    ///
    /// @param json JSON array of journals, not null
    /// @return the journals in their stored order, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static List<Journal> recordingsFromJson(String json) {
        return recordingsFromJson(json, createMapper());
    }

    /// Deserializes a recording set with a caller-configured mapper.
    ///
    /// @param json JSON array of journals, not null
    /// @param mapper mapper from {@link #createMapper(PolymorphicTypeValidator)}, not null
    /// @return the journals in their stored order, never null
    /// @throws IllegalArgumentException if deserialization fails or a recorded value names
    ///     a type the mapper does not allow
    public static List<Journal> recordingsFromJson(String json, ObjectMapper mapper) {
        try {
            return List.copyOf(mapper.readValue(json, RECORDINGS));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize recordings: " + e.getMessage(), e);
        }
    }

    /// Starts a validator allowing the recorded value types every journal may hold.
    ///
    /// Allowed: numbers, strings, booleans, characters, enums, `UUID`, `java.time` values,
    /// and the public `java.util` lists, sets and maps. Extend it with the application
    /// types a search records and pass the result to
    /// {@link #createMapper(PolymorphicTypeValidator)}.
    ///
    /// @return a fresh builder, never null
    public static BasicPolymorphicTypeValidator.Builder recordedValueTypes() {
        return BasicPolymorphicTypeValidator.builder()
                .allowIfSubType(Number.class)
                .allowIfSubType(String.class)
                .allowIfSubType(Boolean.class)
                .allowIfSubType(Character.class)
                .allowIfSubType(Enum.class)
                .allowIfSubType(UUID.class)
                .allowIfSubType("java.time.")
                .allowIfSubType(ArrayList.class)
                .allowIfSubType(LinkedList.class)
                .allowIfSubType(HashSet.class)
                .allowIfSubType(TreeSet.class)
                .allowIfSubType(HashMap.class)
                .allowIfSubType(TreeMap.class);
    }

    /// Creates an ObjectMapper configured for journal serialization with the default
    /// recorded value types.
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return createMapper(recordedValueTypes().build());
    }

    /// Creates an ObjectMapper configured for journal serialization.
    ///
    /// Registers:
    /// - `AsynclyJacksonModule` for journal entries, restoring only `allowedTypes`
    /// - `Jdk8Module` so `Optional` values of recorded effects round-trip
    /// - `JavaTimeModule` so `java.time` values of recorded effects round-trip
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @param allowedTypes validator for recorded value types, not null
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper(PolymorphicTypeValidator allowedTypes) {
        return new ObjectMapper()
                .registerModule(new AsynclyJacksonModule(allowedTypes))
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
