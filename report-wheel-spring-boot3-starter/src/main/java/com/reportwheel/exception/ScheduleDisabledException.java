package com.reportwheel.exception;

public class ScheduleDisabledException extends ReportWheelException {

    public ScheduleDisabledException(String scheduleId) {
        super("SCHEDULE_DISABLED", "Cannot execute disabled schedule: " + scheduleId);
    }
}
