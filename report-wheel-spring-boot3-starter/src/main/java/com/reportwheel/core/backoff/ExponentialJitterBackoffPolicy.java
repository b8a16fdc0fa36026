package com.reportwheel.core.backoff;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.spi.BackoffPolicy;
import com.reportwheel.model.RetryPolicy;

import java.util.concurrent.ThreadLocalRandom;

/**
 * retry_delay × backoff_multiplier^(attempt-1), 可选抖动, 以 maxDelay 封顶
 */
public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public long delayMillis(int attempt, RetryPolicy policy, ReportWheelProperties props) {
        long base = policy.getRetryDelay();
        double multiplier = policy.getBackoffMultiplier();
        long max = props.getRetry().getMaxDelay().toMillis();
        double jr = props.getRetry().getJitterRatio();

        // attempt 从1开始：1 -> base, 2 -> base * m, 3 -> base * m^2
        double pow = Math.pow(multiplier, Math.max(0, attempt - 1));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        long jittered = ideal;
        if (jr > 0) {
            jittered = ideal + Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal);
        }
        return Math.max(0, Math.min(jittered, max));
    }
}
