package io.avalonrest.json.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.avalonrest.json.spi.JsonCodec;
import io.avalonrest.json.spi.JsonException;
import io.avalonrest.json.spi.JsonNode;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>The default mapper writes {@code java.time} values as ISO-8601 text, binds property names
 * case-insensitively and ignores unknown properties. Java property names are already camelCase,
 * so no naming strategy is applied.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the mapper used when none is supplied.
     */
    public static ObjectMapper defaultMapper() {
        SimpleModule treeModule = new SimpleModule("avalon-json-node");
        treeModule.addSerializer(JsonNode.class, new JsonNodeSerializer());
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(treeModule)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Type type) throws JsonException {
        try {
            return mapper.readValue(data, mapper.constructType(type));
        } catch (Exception e) {
            throw failure(e, type);
        }
    }

    @Override
    public <T> T readValue(String json, Type type) throws JsonException {
        try {
            return mapper.readValue(json, mapper.constructType(type));
        } catch (Exception e) {
            throw failure(e, type);
        }
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        try {
            return JacksonJsonNode.wrap(mapper.readTree(data), mapper);
        } catch (Exception e) {
            throw failure(e, null);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        try {
            return JacksonJsonNode.wrap(mapper.readTree(json), mapper);
        } catch (Exception e) {
            throw failure(e, null);
        }
    }

    @Override
    public <T> T convert(JsonNode node, Type type) throws JsonException {
        Objects.requireNonNull(node, "node");
        try {
            com.fasterxml.jackson.databind.JsonNode tree = node instanceof JacksonJsonNode jjn
                    ? jjn.delegate
                    : mapper.readTree(node.toJson());
            return mapper.readerFor(mapper.constructType(type)).readValue(tree);
        } catch (Exception e) {
            throw failure(e, type);
        }
    }

    /**
     * Builds an exception whose message holds only the parse location, never the input.
     */
    private static JsonException failure(Exception e, Type type) {
        String where = "";
        if (e instanceof JsonProcessingException jpe) {
            JsonLocation loc = jpe.getLocation();
            if (loc != null && loc.getLineNr() > 0) {
                where = " at line " + loc.getLineNr() + ", column " + loc.getColumnNr();
            }
        }
        if (e instanceof StreamReadException || type == null) {
            return new JsonException("Malformed JSON" + where, e);
        }
        return new JsonException("JSON does not match " + type.getTypeName() + where, e);
    }

    private static final class JsonNodeSerializer extends StdSerializer<JsonNode> {
        JsonNodeSerializer() {
            super(JsonNode.class);
        }

        @Override
        public void serialize(JsonNode value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value instanceof JacksonJsonNode jjn) {
                gen.writeTree(jjn.delegate);
            } else {
                gen.writeRawValue(value.toJson());
            }
        }
    }
}
