package com.reportwheel.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * JSON 列序列化
 */
public interface PayloadSerializer {

    <T> T deserialize(String json, Class<T> type);

    <T> T deserialize(String json, TypeReference<T> typeRef);

    String serialize(Object obj);
}
