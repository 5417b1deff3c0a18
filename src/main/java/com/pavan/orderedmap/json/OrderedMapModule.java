package com.pavan.orderedmap.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.pavan.orderedmap.collection.OrderedMap;

import java.io.IOException;

/**
 * Jackson module teaching an {@code ObjectMapper} to read and write {@link OrderedMap}s,
 * including maps nested inside other values.
 * <p>
 * Pretty printing follows the mapper's own settings; {@link JsonOptions#isPrettyPrint()}
 * is ignored here.
 */
public class OrderedMapModule extends SimpleModule {
    
    private static final long serialVersionUID = 1L;
    
    public OrderedMapModule() {
        this(JsonOptions.defaults());
    }
    
    @SuppressWarnings({"rawtypes", "unchecked"})
    public OrderedMapModule(JsonOptions options) {
        super("OrderedMapModule");
        JsonOptions effective = JsonOptions.orDefaults(options);
        addSerializer((Class) OrderedMap.class, new OrderedMapSerializer(effective));
        addDeserializer((Class) OrderedMap.class, new OrderedMapDeserializer(effective));
    }
    
    static class OrderedMapSerializer extends StdSerializer<OrderedMap<?, ?>> {
        
        private static final long serialVersionUID = 1L;
        
        private final JsonOptions options;
        
        OrderedMapSerializer(JsonOptions options) {
            super(OrderedMap.class, false);
            this.options = options;
        }
        
        @Override
        public void serialize(OrderedMap<?, ?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            new OrderedMapJsonWriter(options, provider::defaultSerializeValue).write(value, gen);
        }
        
        @Override
        public boolean isEmpty(SerializerProvider provider, OrderedMap<?, ?> value) {
            return value.isEmpty();
        }
    }
    
    static class OrderedMapDeserializer extends StdDeserializer<OrderedMap<Object, Object>> {
        
        private static final long serialVersionUID = 1L;
        
        private final JsonOptions options;
        
        OrderedMapDeserializer(JsonOptions options) {
            super(OrderedMap.class);
            this.options = options;
        }
        
        @Override
        public OrderedMap<Object, Object> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            OrderedMap<Object, Object> map = new OrderedMap<>();
            map.replaceWith(new OrderedMapJsonReader(options).readEntries(p));
            return map;
        }
    }
}
