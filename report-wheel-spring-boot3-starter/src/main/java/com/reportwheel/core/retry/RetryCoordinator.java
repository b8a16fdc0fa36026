package com.reportwheel.core.retry;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.backoff.BackoffRegistry;
import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.model.DeliveryMethod;
import com.reportwheel.model.RetryPolicy;
import com.reportwheel.model.ctx.FailureContext;
import com.reportwheel.model.entity.ReportScheduleEntity;

import java.time.Clock;
import java.time.Instant;

/**
 * 重试/退避决策, 执行级与通道级共用
 *
 * used/allowed 为"已用重试次数/允许重试次数":
 * 执行传 (retryCount, maxAttempts); 通道传 (attemptCount - 1, budget - 1)
 */
public class RetryCoordinator {

    private final BackoffRegistry backoff;

    private final FailureDecider failureDecider;

    private final PayloadSerializer serializer;

    private final ReportWheelProperties props;

    private final Clock clock;

    public RetryCoordinator(BackoffRegistry backoff,
                            FailureDecider failureDecider,
                            PayloadSerializer serializer,
                            ReportWheelProperties props,
                            Clock clock) {
        this.backoff = backoff;
        this.failureDecider = failureDecider;
        this.serializer = serializer;
        this.props = props;
        this.clock = clock;
    }

    public boolean shouldRetry(int attemptCount, int maxAttempts) {
        return attemptCount < maxAttempts;
    }

    /**
     * 第 attempt 次重试（从1开始）前的等待
     */
    public long delayFor(int attempt, RetryPolicy policy) {
        return backoff.delayMillis(attempt, policy);
    }

    public RetryDecision decide(int used, int allowed, RetryPolicy policy, Throwable failure, FailureContext ctx) {
        FailureDecider.Decision d = failureDecider.decide(failure, ctx);
        if (!d.retryable()) {
            return RetryDecision.nonRetryable(d);
        }
        if (!shouldRetry(used, allowed)) {
            return RetryDecision.exhausted(d);
        }
        int attempt = used + 1;
        long delay = delayFor(attempt, policy);
        Instant resumeAt = clock.instant().plusMillis(delay);
        return RetryDecision.retry(attempt, delay, resumeAt, d);
    }

    /**
     * 全局默认策略
     */
    public RetryPolicy defaults() {
        ReportWheelProperties.Retry r = props.getRetry();
        return new RetryPolicy(r.getMaxAttempts(), r.getRetryDelay().toMillis(), r.getBackoffMultiplier());
    }

    /**
     * 调度级策略, 缺省字段取全局默认
     */
    public RetryPolicy policyOf(ReportScheduleEntity schedule) {
        if (schedule == null || schedule.getRetryConfig() == null || schedule.getRetryConfig().isBlank()) {
            return defaults();
        }
        RetryPolicy p = serializer.deserialize(schedule.getRetryConfig(), RetryPolicy.class);
        return p == null ? defaults() : p.mergeWith(defaults());
    }

    /**
     * 通道级策略: 通道覆盖 → 调度 → 全局
     */
    public RetryPolicy policyOf(ReportScheduleEntity schedule, DeliveryMethod method) {
        RetryPolicy base = policyOf(schedule);
        if (method == null || method.getRetry() == null) {
            return base;
        }
        return method.getRetry().mergeWith(base);
    }
}
