package com.pavan.orderedmap.json;

import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.pavan.orderedmap.collection.OrderedMap;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes an {@link OrderedMap} as a JSON object, field by field in insertion order.
 * Keys whose text forms collide (such as {@code 1} and {@code "1"}) become one member:
 * it sits where the first of them was and holds the value of the last, the same
 * outcome decoding gives for a repeated member name.
 * Non-finite {@code Double} and {@code Float} values are rejected.
 */
final class OrderedMapJsonWriter {
    
    /**
     * Writes values that are not maps or numeric strings, typically by delegating to databind.
     */
    @FunctionalInterface
    interface ValueWriter {
        void write(Object value, JsonGenerator gen) throws IOException;
    }
    
    private final JsonOptions options;
    private final ValueWriter valueWriter;
    
    OrderedMapJsonWriter(JsonOptions options, ValueWriter valueWriter) {
        this.options = JsonOptions.orDefaults(options);
        this.valueWriter = valueWriter;
    }
    
    /**
     * Writes the map from a snapshot of its entries, so the map's lock is not held during output.
     *
     * @return the number of members written
     */
    int write(OrderedMap<?, ?> map, JsonGenerator gen) throws IOException {
        Map<String, Object> members = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entries()) {
            members.put(fieldName(entry.getKey(), gen), entry.getValue());
        }
        gen.writeStartObject();
        for (Map.Entry<String, Object> member : members.entrySet()) {
            gen.writeFieldName(member.getKey());
            writeValue(member.getValue(), gen);
        }
        gen.writeEndObject();
        return members.size();
    }
    
    private String fieldName(Object key, JsonGenerator gen) throws JsonGenerationException {
        if (key instanceof String) {
            return (String) key;
        }
        if (options.isForceTextKeys()) {
            return String.valueOf(key);
        }
        throw new JsonGenerationException("non-string key " + key + " cannot be converted to JSON", gen);
    }
    
    private void writeValue(Object value, JsonGenerator gen) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof OrderedMap) {
            write((OrderedMap<?, ?>) value, gen);
        } else if (options.isPreserveNumericType() && value instanceof String) {
            Number number = NumericText.parse((String) value);
            if (number instanceof Long) {
                gen.writeNumber(number.longValue());
            } else if (number != null) {
                gen.writeNumber(number.doubleValue());
            } else {
                gen.writeString((String) value);
            }
        } else if (isNonFinite(value)) {
            throw new JsonGenerationException("non-finite number " + value + " cannot be converted to JSON", gen);
        } else {
            valueWriter.write(value, gen);
        }
    }
    
    private static boolean isNonFinite(Object value) {
        if (value instanceof Double) {
            return !Double.isFinite((Double) value);
        }
        if (value instanceof Float) {
            return !Float.isFinite((Float) value);
        }
        return false;
    }
}
