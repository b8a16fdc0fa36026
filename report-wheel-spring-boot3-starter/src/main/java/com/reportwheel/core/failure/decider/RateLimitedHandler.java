package com.reportwheel.core.failure.decider;

import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.exception.guard.ChannelRateLimitedException;
import com.reportwheel.model.ctx.FailureContext;

/**
 * 限流拒绝
 */
public class RateLimitedHandler implements FailureCaseHandler<ChannelRateLimitedException> {
    @Override
    public Class<ChannelRateLimitedException> exceptionType() {
        return ChannelRateLimitedException.class;
    }

    @Override
    public FailureDecider.Decision execute(ChannelRateLimitedException ex, FailureContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.RATE_LIMITED)
                .withCode("RATE_LIMIT");
    }
}
