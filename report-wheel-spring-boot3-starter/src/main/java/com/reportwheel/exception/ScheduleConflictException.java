package com.reportwheel.exception;

/**
 * 乐观锁冲突: 调度在读取后被其他操作修改
 */
public class ScheduleConflictException extends ReportWheelException {

    public ScheduleConflictException(String scheduleId) {
        super("SCHEDULE_CONFLICT", "Report schedule was modified concurrently: " + scheduleId);
    }
}
