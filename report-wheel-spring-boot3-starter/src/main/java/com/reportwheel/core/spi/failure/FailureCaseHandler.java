package com.reportwheel.core.spi.failure;

import com.reportwheel.model.ctx.FailureContext;

/**
 * 异常处理器 SPI
 */
public interface FailureCaseHandler<E extends Throwable> {

    /**
     * 返回能够处理的异常类型
     */
    Class<E> exceptionType();

    default boolean supports(Throwable t) {
        return exceptionType().isInstance(t);
    }

    FailureDecider.Decision execute(E ex, FailureContext ctx);
}
