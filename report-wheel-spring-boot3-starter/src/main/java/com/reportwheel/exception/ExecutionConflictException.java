package com.reportwheel.exception;

/**
 * 调度已有非终态执行, 或执行状态已不允许该操作
 */
public class ExecutionConflictException extends ReportWheelException {

    public ExecutionConflictException(String message) {
        super("EXECUTION_CONFLICT", message);
    }
}
