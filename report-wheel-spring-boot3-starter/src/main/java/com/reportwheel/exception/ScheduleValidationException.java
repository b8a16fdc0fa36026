package com.reportwheel.exception;

/**
 * 创建/更新时同步拒绝: 非法 cron、未知时区、空投递列表等
 */
public class ScheduleValidationException extends ReportWheelException {

    public ScheduleValidationException(String code, String message) {
        super(code, message);
    }

    public ScheduleValidationException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
