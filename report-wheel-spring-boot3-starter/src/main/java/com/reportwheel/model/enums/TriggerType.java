package com.reportwheel.model.enums;

/**
 * 触发来源
 */
public enum TriggerType {
    /** 扫描器按 cron 触发 */
    CRON,

    /** 手动触发 */
    MANUAL
}
