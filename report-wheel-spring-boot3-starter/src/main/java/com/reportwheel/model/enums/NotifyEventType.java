package com.reportwheel.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 执行达到最大重试, 永久失败 */
    EXECUTION_FAILED,

    /** 不可重试的执行失败 */
    NON_RETRYABLE_FAILED,

    /** 单通道投递耗尽预算 */
    DELIVERY_FAILED,

    /** 启动时回收的孤儿执行 */
    ORPHAN_RECOVERED,

    /** 调度仍在执行, 本次触发被跳过 */
    OVERLAP_SKIPPED,

    /** 持久化失败（Mapper/DB） */
    PERSIST_FAILED,

    /** 引擎级异常（线程池拒绝、调度异常等） */
    ENGINE_ERROR
}
