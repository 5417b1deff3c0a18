package com.pavan.orderedmap.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pavan.orderedmap.collection.OrderedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link OrderedMap}s to JSON bytes and back while keeping key order.
 * Encoding streams fields straight from the map's entry order into a Jackson
 * {@link JsonGenerator}; decoding walks {@link JsonParser} tokens and inserts
 * members in the order they appear in the text.
 * <p>
 * Values that are not strings, numbers, booleans, null or nested ordered maps are
 * written by the configured {@link ObjectMapper}.
 */
public class OrderedMapCodec {
    
    private static final Logger logger = LoggerFactory.getLogger(OrderedMapCodec.class);
    
    private final ObjectMapper mapper;
    
    /**
     * Creates a codec whose mapper knows {@link OrderedMapModule}, so ordered maps nested
     * in lists or beans are written in order too.
     */
    public OrderedMapCodec() {
        this(new ObjectMapper().registerModule(new OrderedMapModule()));
    }
    
    public OrderedMapCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }
    
    /**
     * Encodes the map as a JSON object.
     *
     * @param map the map to encode
     * @param options encoding options, or null for {@link JsonOptions#defaults()}
     * @return UTF-8 JSON bytes
     * @throws com.fasterxml.jackson.core.JsonGenerationException if a key is not a string
     *         and {@link JsonOptions#isForceTextKeys()} is off
     * @throws IOException if a value cannot be encoded
     */
    public byte[] serialize(OrderedMap<?, ?> map, JsonOptions options) throws IOException {
        JsonOptions effective = JsonOptions.orDefaults(options);
        OrderedMapJsonWriter writer = new OrderedMapJsonWriter(effective, (value, gen) -> gen.writeObject(value));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int count;
        try (JsonGenerator gen = mapper.createGenerator(out)) {
            if (effective.isPrettyPrint()) {
                gen.useDefaultPrettyPrinter();
            }
            count = writer.write(map, gen);
        }
        logger.debug("Encoded {} members into {} bytes", count, out.size());
        return out.toByteArray();
    }
    
    public String serializeToString(OrderedMap<?, ?> map, JsonOptions options) throws IOException {
        return new String(serialize(map, options), StandardCharsets.UTF_8);
    }
    
    /**
     * Decodes a JSON object into the target map, replacing its content.
     * The target is only touched once the whole input has parsed, so a failed
     * decode leaves it as it was.
     *
     * @param json UTF-8 JSON bytes holding one object
     * @param target the map to fill
     * @param options decoding options, or null for {@link JsonOptions#defaults()}
     * @throws JsonParseException if the input is null, empty, malformed, not an object,
     *         or followed by trailing content
     */
    public void deserialize(byte[] json, OrderedMap<Object, Object> target, JsonOptions options) throws IOException {
        if (json == null || json.length == 0) {
            throw new JsonParseException(null, "No JSON content to decode");
        }
        OrderedMapJsonReader reader = new OrderedMapJsonReader(options);
        List<Map.Entry<Object, Object>> entries;
        try (JsonParser p = mapper.createParser(json)) {
            p.nextToken();
            entries = reader.readEntries(p);
            if (p.nextToken() != null) {
                throw new JsonParseException(p, "Unexpected trailing content after JSON object: " + p.currentToken());
            }
        }
        target.replaceWith(entries);
        logger.debug("Decoded {} members into {} entries", entries.size(), target.size());
    }
    
    /**
     * Decodes a JSON object into a new map.
     *
     * @see #deserialize(byte[], OrderedMap, JsonOptions)
     */
    public OrderedMap<Object, Object> deserialize(byte[] json, JsonOptions options) throws IOException {
        OrderedMap<Object, Object> map = new OrderedMap<>();
        deserialize(json, map, options);
        return map;
    }
    
    public OrderedMap<Object, Object> deserialize(String json, JsonOptions options) throws IOException {
        return deserialize(json == null ? null : json.getBytes(StandardCharsets.UTF_8), options);
    }
}
