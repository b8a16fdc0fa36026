package com.reportwheel.core.spi;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.model.RetryPolicy;

/**
 * 退避策略（计算第 n 次重试前的等待）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"） */
    String name();

    /**
     * @param attempt 第几次重试, 从 1 开始
     * @param policy  已补全默认值的重试策略
     * @param props   全局配置（jitter/maxDelay）
     * @return 延迟毫秒
     */
    long delayMillis(int attempt, RetryPolicy policy, ReportWheelProperties props);
}
