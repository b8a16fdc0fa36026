package com.reportwheel.exception;

public class DeliveryFailedException extends CollaboratorFailureException {

    public DeliveryFailedException(String message, boolean retryable) {
        super("DELIVERY_FAILED", message, retryable, null);
    }

    public DeliveryFailedException(String message, boolean retryable, Throwable cause) {
        super("DELIVERY_FAILED", message, retryable, cause);
    }

    protected DeliveryFailedException(String code, String message, boolean retryable, Throwable cause) {
        super(code, message, retryable, cause);
    }
}
