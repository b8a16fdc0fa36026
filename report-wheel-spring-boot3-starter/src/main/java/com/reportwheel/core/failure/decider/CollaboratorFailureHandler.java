package com.reportwheel.core.failure.decider;

import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.exception.CollaboratorFailureException;
import com.reportwheel.exception.OrphanedExecutionException;
import com.reportwheel.model.ctx.FailureContext;

/**
 * 生成器/通道自报的失败, 以 retryable 为准
 */
public class CollaboratorFailureHandler implements FailureCaseHandler<CollaboratorFailureException> {

    @Override
    public Class<CollaboratorFailureException> exceptionType() {
        return CollaboratorFailureException.class;
    }

    @Override
    public FailureDecider.Decision execute(CollaboratorFailureException ex, FailureContext ctx) {
        FailureDecider.Category category;
        if (ex instanceof ChannelConfigException) {
            category = FailureDecider.Category.CONFIG;
        } else if (ex instanceof OrphanedExecutionException) {
            category = FailureDecider.Category.ORPHANED;
        } else {
            category = FailureDecider.Category.COLLABORATOR;
        }
        FailureDecider.Outcome outcome = ex.isRetryable() ? FailureDecider.Outcome.RETRY : FailureDecider.Outcome.FAILED;
        return FailureDecider.Decision.of(outcome, category)
                .withCode(ex.isRetryable() ? ex.getCode() : "NON_RETRYABLE")
                .withMsg(ex.getMessage());
    }
}
