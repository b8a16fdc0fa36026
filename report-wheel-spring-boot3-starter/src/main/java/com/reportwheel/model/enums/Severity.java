package com.reportwheel.model.enums;

/**
 * 通知级别
 */
public enum Severity {
    CRITICAL,
    ERROR,
    WARNING,
    INFO
}
