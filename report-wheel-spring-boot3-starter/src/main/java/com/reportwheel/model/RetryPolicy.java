package com.reportwheel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 重试策略 (max_attempts, retry_delay, backoff_multiplier)
 * 字段为空时取默认值
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetryPolicy {

    /** 最大次数 */
    private Integer maxAttempts;

    /** 基础延迟(ms) */
    private Long retryDelay;

    /** 退避倍数 */
    private Double backoffMultiplier;

    /**
     * 以 fallback 补全空字段
     */
    public RetryPolicy mergeWith(RetryPolicy fallback) {
        if (fallback == null) {
            return this;
        }
        return new RetryPolicy(
                maxAttempts != null ? maxAttempts : fallback.maxAttempts,
                retryDelay != null ? retryDelay : fallback.retryDelay,
                backoffMultiplier != null ? backoffMultiplier : fallback.backoffMultiplier);
    }
}
