package com.reportwheel.exception;

public class DeliveryNotFoundException extends ReportWheelException {

    public DeliveryNotFoundException(String message) {
        super("DELIVERY_NOT_FOUND", message);
    }
}
