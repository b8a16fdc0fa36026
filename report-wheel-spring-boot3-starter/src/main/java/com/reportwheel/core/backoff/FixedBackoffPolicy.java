package com.reportwheel.core.backoff;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.spi.BackoffPolicy;
import com.reportwheel.model.RetryPolicy;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔, 忽略 backoff_multiplier
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public long delayMillis(int attempt, RetryPolicy policy, ReportWheelProperties props) {
        long delay = policy.getRetryDelay();
        double jr = props.getRetry().getJitterRatio();
        if (jr > 0) {
            delay += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * delay);
        }
        return Math.max(0, Math.min(delay, props.getRetry().getMaxDelay().toMillis()));
    }
}
