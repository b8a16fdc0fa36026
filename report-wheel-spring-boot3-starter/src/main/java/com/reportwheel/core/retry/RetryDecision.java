package com.reportwheel.core.retry;

import com.reportwheel.core.spi.failure.FailureDecider;
import lombok.Getter;

import java.time.Instant;

/**
 * Coordinator 的一次决策
 */
@Getter
public final class RetryDecision {

    public enum Verdict { RETRY, EXHAUSTED, NON_RETRYABLE }

    private final Verdict verdict;

    /** 第几次重试, 仅 RETRY */
    private final int attempt;

    private final long delayMillis;

    private final Instant resumeAt;

    private final FailureDecider.Decision cause;

    private RetryDecision(Verdict verdict, int attempt, long delayMillis, Instant resumeAt, FailureDecider.Decision cause) {
        this.verdict = verdict;
        this.attempt = attempt;
        this.delayMillis = delayMillis;
        this.resumeAt = resumeAt;
        this.cause = cause;
    }

    static RetryDecision retry(int attempt, long delayMillis, Instant resumeAt, FailureDecider.Decision cause) {
        return new RetryDecision(Verdict.RETRY, attempt, delayMillis, resumeAt, cause);
    }

    static RetryDecision exhausted(FailureDecider.Decision cause) {
        return new RetryDecision(Verdict.EXHAUSTED, 0, 0, null, cause);
    }

    static RetryDecision nonRetryable(FailureDecider.Decision cause) {
        return new RetryDecision(Verdict.NON_RETRYABLE, 0, 0, null, cause);
    }

    public boolean isRetry() {
        return verdict == Verdict.RETRY;
    }

    public String reasonCode() {
        return switch (verdict) {
            case RETRY -> cause == null ? "RETRY" : cause.getCode();
            case EXHAUSTED -> "MAX_ATTEMPTS";
            case NON_RETRYABLE -> "NON_RETRYABLE";
        };
    }
}
