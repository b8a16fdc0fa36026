package com.reportwheel.exception;

public class DeliveryRetryRejectedException extends ReportWheelException {

    public DeliveryRetryRejectedException(String message) {
        super("DELIVERY_RETRY_REJECTED", message);
    }
}
