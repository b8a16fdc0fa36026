package com.reportwheel.exception;

/**
 * 框架异常基类, code 用于上层映射错误码
 */
public class ReportWheelException extends RuntimeException {

    private final String code;

    public ReportWheelException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ReportWheelException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
