package com.reportwheel.model.enums;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * 执行状态
 * 0=PENDING,1=RUNNING,2=COMPLETED,3=FAILED,4=CANCELLED,5=RETRYING
 */
public enum ExecutionStatus {
    PENDING(0, "pending"),
    RUNNING(1, "running"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed"),
    CANCELLED(4, "cancelled"),
    RETRYING(5, "retrying");

    public final int code;

    public final String value;

    ExecutionStatus(int code, String value) {
        this.code = code;
        this.value = value;
    }

    /** 非终态: 同一调度同一时刻最多一个 */
    public static final Set<ExecutionStatus> ACTIVE = EnumSet.of(PENDING, RUNNING, RETRYING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return !isActive();
    }

    public static ExecutionStatus of(Integer code) {
        if (code == null) {
            throw new IllegalArgumentException("execution status code is null");
        }
        return Arrays.stream(values())
                .filter(s -> s.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown execution status code " + code));
    }

    public static ExecutionStatus from(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown execution status " + value));
    }
}
