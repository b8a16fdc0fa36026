package com.reportwheel.exception;

public class ExecutionNotFoundException extends ReportWheelException {

    public ExecutionNotFoundException(String executionId) {
        super("EXECUTION_NOT_FOUND", "Schedule execution not found: " + executionId);
    }
}
