package com.reportwheel.core.failure.decider;

import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.exception.guard.ChannelBulkheadFullException;
import com.reportwheel.model.ctx.FailureContext;

/**
 * 通道并发已满
 */
public class BulkheadFullHandler implements FailureCaseHandler<ChannelBulkheadFullException> {

    @Override
    public Class<ChannelBulkheadFullException> exceptionType() { return ChannelBulkheadFullException.class; }

    @Override
    public FailureDecider.Decision execute(ChannelBulkheadFullException ex, FailureContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.BULKHEAD_FULL)
                .withCode("BULKHEAD_FULL");
    }
}
