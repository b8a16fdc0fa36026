package com.reportwheel.model.enums;

import java.util.Arrays;

/**
 * 投递日志状态（每次尝试追加一行）
 */
public enum DeliveryLogStatus {
    PENDING(0, "pending"),
    DELIVERED(1, "delivered"),
    FAILED(2, "failed"),
    RETRYING(3, "retrying");

    public final int code;

    public final String value;

    DeliveryLogStatus(int code, String value) {
        this.code = code;
        this.value = value;
    }

    public static DeliveryLogStatus of(Integer code) {
        return Arrays.stream(values())
                .filter(s -> code != null && s.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown delivery log status code " + code));
    }

    public static DeliveryLogStatus from(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown delivery log status " + value));
    }
}
