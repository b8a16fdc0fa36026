package com.reportwheel.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 投递通道（封闭集合）
 */
public enum DeliveryMethodType {
    EMAIL("email"),
    FILE_STORAGE("file_storage"),
    API_ENDPOINT("api_endpoint"),
    WEBHOOK("webhook");

    private final String code;

    DeliveryMethodType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static DeliveryMethodType from(String value) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown delivery method " + value));
    }
}
