package com.reportwheel.exception;

/**
 * 外部协作方（生成器、投递通道）的失败, 自带是否可重试
 */
public abstract class CollaboratorFailureException extends ReportWheelException {

    private final boolean retryable;

    protected CollaboratorFailureException(String code, String message, boolean retryable, Throwable cause) {
        super(code, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
