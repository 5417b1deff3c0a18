package com.pavan.orderedmap.json;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;

/**
 * Reads a JSON object token by token, yielding its members in textual order.
 * Nested objects become {@link LinkedHashMap}s with string keys and arrays become
 * {@link ArrayList}s; numbers follow {@link JsonOptions#isPreserveNumericType()}.
 */
final class OrderedMapJsonReader {
    
    private final JsonOptions options;
    
    OrderedMapJsonReader(JsonOptions options) {
        this.options = JsonOptions.orDefaults(options);
    }
    
    /**
     * Reads the members of the object the parser is positioned on.
     * Leaves the parser sitting on the object's END_OBJECT token.
     */
    List<Map.Entry<Object, Object>> readEntries(JsonParser p) throws IOException {
        expect(START_OBJECT, p);
        List<Map.Entry<Object, Object>> entries = new ArrayList<>();
        while (p.nextToken() != END_OBJECT) {
            Object key = convertKey(p.currentName());
            p.nextToken();
            entries.add(new AbstractMap.SimpleEntry<>(key, readValue(p)));
        }
        return entries;
    }
    
    private Object convertKey(String name) {
        if (options.isForceTextKeys()) {
            return name;
        }
        Number number = NumericText.parse(name);
        return number == null ? name : number;
    }
    
    private Object readValue(JsonParser p) throws IOException {
        JsonToken token = p.currentToken();
        if (token == null) {
            throw new JsonParseException(p, "Unexpected end of input");
        }
        switch (token) {
            case START_OBJECT: {
                Map<String, Object> object = new LinkedHashMap<>();
                while (p.nextToken() != END_OBJECT) {
                    String name = p.currentName();
                    p.nextToken();
                    object.put(name, readValue(p));
                }
                return object;
            }
            case START_ARRAY: {
                List<Object> array = new ArrayList<>();
                while (p.nextToken() != END_ARRAY) {
                    array.add(readValue(p));
                }
                return array;
            }
            case VALUE_STRING:
                return p.getText();
            case VALUE_NUMBER_INT:
                if (!options.isPreserveNumericType()) {
                    return p.getDoubleValue();
                }
                if (p.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                    return p.getBigIntegerValue();
                }
                return p.getLongValue();
            case VALUE_NUMBER_FLOAT:
                return options.isPreserveNumericType() ? p.getDecimalValue() : (Object) p.getDoubleValue();
            case VALUE_TRUE:
                return Boolean.TRUE;
            case VALUE_FALSE:
                return Boolean.FALSE;
            case VALUE_NULL:
                return null;
            default:
                throw new JsonParseException(p, "Unexpected token " + token);
        }
    }
    
    static void expect(JsonToken expected, JsonParser p) throws IOException {
        if (p.currentToken() != expected) {
            throw new JsonParseException(p, "Expected " + expected + "; found " + p.currentToken());
        }
    }
}
