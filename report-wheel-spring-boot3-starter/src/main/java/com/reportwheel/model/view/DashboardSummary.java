package com.reportwheel.model.view;

import com.reportwheel.model.entity.ReportScheduleEntity;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class DashboardSummary {

    private final long totalSchedules;

    private final long activeSchedules;

    private final long inactiveSchedules;

    private final long executionsToday;

    private final long completedToday;

    private final long failedToday;

    private final long runningNow;

    /** 0..100, 保留一位小数 */
    private final double executionSuccessRate;

    private final long deliveriesToday;

    private final long deliveredToday;

    private final double deliverySuccessRate;

    private final List<ReportScheduleEntity> upcoming;
}
