package com.reportwheel.core.failure.decider;

import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.model.ctx.FailureContext;

import java.util.concurrent.TimeoutException;

/**
 * 生成/投递超时
 */
public class TimeoutHandler implements FailureCaseHandler<TimeoutException> {
    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public FailureDecider.Decision execute(TimeoutException ex, FailureContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.TIMEOUT)
                .withCode("TIMEOUT");
    }
}
