package com.reportwheel.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reportwheel.core.spi.PayloadSerializer;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <T> T deserialize(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + " from JSON", e);
        }
    }

    @Override
    public <T> T deserialize(String json, TypeReference<T> typeRef) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize payload from JSON", e);
        }
    }

    @Override
    public String serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload to JSON", e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        // ISO-8601 字符串
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 反序列化忽略未知字段，增强前后兼容
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
        return m;
    }
}
