package com.reportwheel.model.enums;

import java.util.Arrays;

/**
 * 单通道投递状态
 * 0=PENDING,1=DELIVERED,2=FAILED
 */
public enum DeliveryStatus {
    PENDING(0, "pending"),
    DELIVERED(1, "delivered"),
    FAILED(2, "failed");

    public final int code;

    public final String value;

    DeliveryStatus(int code, String value) {
        this.code = code;
        this.value = value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static DeliveryStatus of(Integer code) {
        return Arrays.stream(values())
                .filter(s -> code != null && s.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown delivery status code " + code));
    }
}
