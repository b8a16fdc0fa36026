package com.reportwheel.model;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通道投递回执, metadata 写入 delivery_log
 */
@Getter
public class DeliveryReceipt {

    private final Map<String, Object> metadata;

    private DeliveryReceipt(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public static DeliveryReceipt empty() {
        return new DeliveryReceipt(new LinkedHashMap<>());
    }

    public static DeliveryReceipt of(String key, Object value) {
        return empty().with(key, value);
    }

    public DeliveryReceipt with(String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
        return this;
    }
}
