package com.reportwheel.core.failure.decider;

import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.model.ctx.FailureContext;

/**
 * 未分类异常, 兜底按瞬时失败重试
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {
    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public FailureDecider.Decision execute(Throwable ex, FailureContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.UNKNOWN)
                .withCode("UNHANDLED");
    }
}
