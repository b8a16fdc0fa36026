package com.reportwheel.core.engine;

import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.exception.ExecutionConflictException;
import com.reportwheel.exception.ScheduleDisabledException;
import com.reportwheel.exception.ScheduleNotFoundException;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.TriggerType;
import com.reportwheel.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 手动触发: 与定时触发共用活跃执行槽, 不推进 next_execution
 */
public class ManualTriggerHandler {

    Logger log = LoggerFactory.getLogger(ManualTriggerHandler.class);

    private final ScheduleStore scheduleStore;

    private final ExecutionStateMachine stateMachine;

    private final ExecutionRunner runner;

    private final ReportWheelMetrics meter;

    private final Clock clock;

    public ManualTriggerHandler(ScheduleStore scheduleStore,
                                ExecutionStateMachine stateMachine,
                                ExecutionRunner runner,
                                ReportWheelMetrics meter,
                                Clock clock) {
        this.scheduleStore = scheduleStore;
        this.stateMachine = stateMachine;
        this.runner = runner;
        this.meter = meter;
        this.clock = clock;
    }

    public ScheduleExecutionEntity trigger(String scheduleId, String requestedBy) {
        ReportScheduleEntity s = scheduleStore.find(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        if (!Boolean.TRUE.equals(s.getEnabled())) {
            throw new ScheduleDisabledException(scheduleId);
        }
        ScheduleExecutionEntity e = stateMachine.open(s, TriggerType.MANUAL, clock.instant(), requestedBy);
        if (e == null) {
            // 区分并发停用与已有活跃执行
            ReportScheduleEntity latest = scheduleStore.find(scheduleId)
                    .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
            if (!Boolean.TRUE.equals(latest.getEnabled())) {
                throw new ScheduleDisabledException(scheduleId);
            }
            throw new ExecutionConflictException("Schedule " + scheduleId + " already has an active execution "
                    + latest.getActiveExecutionId());
        }
        meter.incManualTriggered();
        log.info("[Execution] manual trigger schedule={} execution={} by={}", scheduleId, e.getExecutionId(), requestedBy);
        runner.submit(e.getExecutionId());
        return e;
    }
}
