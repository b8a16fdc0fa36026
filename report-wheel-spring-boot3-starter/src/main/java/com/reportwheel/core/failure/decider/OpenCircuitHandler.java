package com.reportwheel.core.failure.decider;

import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.exception.guard.ChannelOpenCircuitException;
import com.reportwheel.model.ctx.FailureContext;

/**
 * 通道熔断打开
 */
public class OpenCircuitHandler implements FailureCaseHandler<ChannelOpenCircuitException> {
    @Override
    public Class<ChannelOpenCircuitException> exceptionType() {
        return ChannelOpenCircuitException.class;
    }

    @Override
    public FailureDecider.Decision execute(ChannelOpenCircuitException ex, FailureContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.OPEN_CIRCUIT)
                .withCode("CB_OPEN");
    }
}
