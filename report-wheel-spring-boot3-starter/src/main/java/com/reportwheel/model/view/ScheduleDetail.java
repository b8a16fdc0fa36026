package com.reportwheel.model.view;

import com.reportwheel.model.entity.ReportScheduleEntity;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class ScheduleDetail {

    private final ReportScheduleEntity schedule;

    private final List<ExecutionView> recentExecutions;
}
