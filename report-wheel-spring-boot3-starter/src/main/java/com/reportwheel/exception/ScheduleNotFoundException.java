package com.reportwheel.exception;

public class ScheduleNotFoundException extends ReportWheelException {

    public ScheduleNotFoundException(String scheduleId) {
        super("SCHEDULE_NOT_FOUND", "Report schedule not found: " + scheduleId);
    }
}
