package com.reportwheel.service;

import com.baomidou.mybatisplus.core.toolkit.StringUtils;
import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.cron.CronEvaluator;
import com.reportwheel.core.delivery.DeliveryDispatcher;
import com.reportwheel.core.engine.CancellationRegistry;
import com.reportwheel.core.engine.ExecutionStateMachine;
import com.reportwheel.core.engine.ManualTriggerHandler;
import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.exception.ExecutionNotFoundException;
import com.reportwheel.exception.ScheduleConflictException;
import com.reportwheel.exception.ScheduleNotFoundException;
import com.reportwheel.exception.ScheduleValidationException;
import com.reportwheel.model.ScheduleCommand;
import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.entity.DeliveryLogEntity;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.model.query.DeliveryLogQuery;
import com.reportwheel.model.query.ExecutionQuery;
import com.reportwheel.model.query.ScheduleQuery;
import com.reportwheel.model.view.ChannelState;
import com.reportwheel.model.view.ExecutionView;
import com.reportwheel.model.view.PageResult;
import com.reportwheel.model.view.ScheduleDetail;
import com.reportwheel.store.DeliveryStore;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 调度管理门面: 增删改查、手动触发、取消、投递重试
 */
public class ReportScheduleService {

    /** 未指定时区的调度按 UTC 计算 */
    public static final String DEFAULT_TIMEZONE = "UTC";

    Logger log = LoggerFactory.getLogger(ReportScheduleService.class);

    private final ScheduleStore scheduleStore;

    private final ExecutionStore executionStore;

    private final DeliveryStore deliveryStore;

    private final ScheduleValidator validator;

    private final CronEvaluator cron;

    private final ManualTriggerHandler manualTrigger;

    private final ExecutionStateMachine stateMachine;

    private final DeliveryDispatcher dispatcher;

    private final CancellationRegistry cancellations;

    private final PayloadSerializer serializer;

    private final TransactionOperations tt;

    private final ReportWheelProperties props;

    private final Clock clock;

    public ReportScheduleService(ScheduleStore scheduleStore,
                                 ExecutionStore executionStore,
                                 DeliveryStore deliveryStore,
                                 ScheduleValidator validator,
                                 CronEvaluator cron,
                                 ManualTriggerHandler manualTrigger,
                                 ExecutionStateMachine stateMachine,
                                 DeliveryDispatcher dispatcher,
                                 CancellationRegistry cancellations,
                                 PayloadSerializer serializer,
                                 TransactionOperations tt,
                                 ReportWheelProperties props,
                                 Clock clock) {
        this.scheduleStore = scheduleStore;
        this.executionStore = executionStore;
        this.deliveryStore = deliveryStore;
        this.validator = validator;
        this.cron = cron;
        this.manualTrigger = manualTrigger;
        this.stateMachine = stateMachine;
        this.dispatcher = dispatcher;
        this.cancellations = cancellations;
        this.serializer = serializer;
        this.tt = tt;
        this.props = props;
        this.clock = clock;
    }

    public PageResult<ReportScheduleEntity> list(ScheduleQuery query) {
        return scheduleStore.page(query == null ? new ScheduleQuery() : query);
    }

    /**
     * 调度详情, 附最近执行及其投递状态与日志
     */
    public ScheduleDetail get(String scheduleId) {
        ReportScheduleEntity s = require(scheduleId);
        List<ScheduleExecutionEntity> recent = executionStore.findRecent(scheduleId, props.getExecution().getRecentLimit());
        return ScheduleDetail.builder()
                .schedule(s)
                .recentExecutions(views(recent))
                .build();
    }

    public ReportScheduleEntity create(ScheduleCommand cmd) {
        if (cmd == null) {
            throw new ScheduleValidationException("INVALID_SCHEDULE", "Schedule definition is required");
        }
        requireText(cmd.getReportId(), "report_id");
        requireText(cmd.getName(), "name");
        String timezone = StringUtils.isBlank(cmd.getTimezone()) ? DEFAULT_TIMEZONE : cmd.getTimezone().trim();
        validator.validateCron(cmd.getCronExpression(), timezone);
        validator.validateDelivery(cmd.getDeliveryConfig());
        validator.validateRetry(cmd.getRetryConfig());

        Instant now = clock.instant();
        boolean enabled = cmd.getEnabled() == null || cmd.getEnabled();
        ReportScheduleEntity s = ReportScheduleEntity.builder()
                .scheduleId(StringUtils.isNotBlank(cmd.getScheduleId()) ? cmd.getScheduleId() : UUID.randomUUID().toString())
                .reportId(cmd.getReportId())
                .name(cmd.getName())
                .description(cmd.getDescription())
                .cronExpression(cmd.getCronExpression().trim())
                .timezone(timezone)
                .enabled(enabled)
                .deliveryConfig(serializer.serialize(cmd.getDeliveryConfig()))
                .reportConfig(cmd.getReportConfig() == null ? null : serializer.serialize(cmd.getReportConfig()))
                .retryConfig(cmd.getRetryConfig() == null ? null : serializer.serialize(cmd.getRetryConfig()))
                .nextExecution(enabled ? cron.nextFireTime(cmd.getCronExpression(), timezone, now) : null)
                .executionCount(0)
                .failureCount(0)
                .version(0)
                .createdAt(now)
                .updatedAt(now)
                .createdBy(cmd.getOperator())
                .updatedBy(cmd.getOperator())
                .build();
        scheduleStore.insert(s);
        log.info("[Schedule] created id={} cron='{}' tz={} next={}", s.getScheduleId(), s.getCronExpression(),
                s.getTimezone(), s.getNextExecution());
        return s;
    }

    /**
     * 更新; 为空字段不变. cron/时区变更或重新启用时以 now 重算下次触发
     */
    public ReportScheduleEntity update(String scheduleId, ScheduleCommand cmd) {
        ReportScheduleEntity cur = require(scheduleId);
        ReportScheduleEntity next = cur.toBuilder().build();

        if (cmd.getReportId() != null) {
            requireText(cmd.getReportId(), "report_id");
            next.setReportId(cmd.getReportId());
        }
        if (cmd.getName() != null) {
            requireText(cmd.getName(), "name");
            next.setName(cmd.getName());
        }
        if (cmd.getDescription() != null) {
            next.setDescription(cmd.getDescription());
        }
        if (cmd.getCronExpression() != null) {
            next.setCronExpression(cmd.getCronExpression().trim());
        }
        if (cmd.getTimezone() != null) {
            next.setTimezone(cmd.getTimezone().trim());
        }
        boolean timingChanged = !Objects.equals(cur.getCronExpression(), next.getCronExpression())
                || !Objects.equals(cur.getTimezone(), next.getTimezone());
        if (timingChanged) {
            validator.validateCron(next.getCronExpression(), next.getTimezone());
        }
        if (cmd.getDeliveryConfig() != null) {
            validator.validateDelivery(cmd.getDeliveryConfig());
            next.setDeliveryConfig(serializer.serialize(cmd.getDeliveryConfig()));
        }
        if (cmd.getReportConfig() != null) {
            next.setReportConfig(serializer.serialize(cmd.getReportConfig()));
        }
        if (cmd.getRetryConfig() != null) {
            validator.validateRetry(cmd.getRetryConfig());
            next.setRetryConfig(serializer.serialize(cmd.getRetryConfig()));
        }
        boolean wasEnabled = Boolean.TRUE.equals(cur.getEnabled());
        if (cmd.getEnabled() != null) {
            next.setEnabled(cmd.getEnabled());
        }
        boolean enabled = Boolean.TRUE.equals(next.getEnabled());

        Instant now = clock.instant();
        if (!enabled) {
            next.setNextExecution(null);
        } else if (timingChanged || !wasEnabled || next.getNextExecution() == null) {
            next.setNextExecution(cron.nextFireTime(next.getCronExpression(), next.getTimezone(), now));
        }
        next.setUpdatedAt(now);
        next.setUpdatedBy(cmd.getOperator());

        if (!scheduleStore.updateDefinition(next)) {
            throw new ScheduleConflictException(scheduleId);
        }
        next.setVersion(cur.getVersion() + 1);
        log.info("[Schedule] updated id={} enabled={} next={}", scheduleId, enabled, next.getNextExecution());
        return next;
    }

    /**
     * 级联删除执行、投递状态与日志; 本进程内运行中的执行收到取消信号
     */
    public void delete(String scheduleId) {
        require(scheduleId);
        List<String> executionIds = executionStore.findIdsOfSchedule(scheduleId);
        tt.executeWithoutResult(status -> {
            deliveryStore.deleteByExecutions(executionIds);
            executionStore.deleteBySchedule(scheduleId);
            if (!scheduleStore.delete(scheduleId)) {
                throw new ScheduleNotFoundException(scheduleId);
            }
        });
        int signalled = cancellations.signalAll(executionIds, "schedule deleted");
        log.info("[Schedule] deleted id={} executions={} signalledRunning={}", scheduleId, executionIds.size(), signalled);
    }

    public ScheduleExecutionEntity trigger(String scheduleId, String requestedBy) {
        return manualTrigger.trigger(scheduleId, requestedBy);
    }

    public ScheduleExecutionEntity cancelExecution(String executionId, String reason) {
        return stateMachine.cancel(executionId, reason == null ? "cancelled by user" : reason);
    }

    public PageResult<ScheduleExecutionEntity> listExecutions(ExecutionQuery query) {
        if (StringUtils.isNotBlank(query.getScheduleId())) {
            require(query.getScheduleId());
        }
        return executionStore.page(query);
    }

    public ExecutionView getExecution(String executionId) {
        ScheduleExecutionEntity e = executionStore.find(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        return views(List.of(e)).get(0);
    }

    public DeliveryAttemptEntity retryDelivery(String logId, boolean fresh) {
        return dispatcher.retryDeliveryLog(logId, fresh);
    }

    public DeliveryAttemptEntity retryChannel(String executionId, DeliveryMethodType channel, boolean fresh) {
        return dispatcher.retryChannel(executionId, channel, fresh);
    }

    public PageResult<DeliveryLogEntity> listDeliveryLogs(DeliveryLogQuery query) {
        return deliveryStore.pageLogs(query == null ? new DeliveryLogQuery() : query);
    }

    private List<ExecutionView> views(List<ScheduleExecutionEntity> executions) {
        if (executions.isEmpty()) {
            return List.of();
        }
        List<String> ids = executions.stream().map(ScheduleExecutionEntity::getExecutionId).toList();
        Map<String, List<DeliveryAttemptEntity>> attempts = deliveryStore.findAttempts(ids).stream()
                .collect(Collectors.groupingBy(DeliveryAttemptEntity::getExecutionId));
        Map<String, List<DeliveryLogEntity>> logs = deliveryStore.findLogs(ids).stream()
                .collect(Collectors.groupingBy(DeliveryLogEntity::getExecutionId));
        return executions.stream().map(e -> {
            Map<DeliveryMethodType, ChannelState> states = new LinkedHashMap<>();
            attempts.getOrDefault(e.getExecutionId(), List.of())
                    .forEach(a -> states.put(a.channelType(), ChannelState.of(a)));
            return ExecutionView.builder()
                    .execution(e)
                    .deliveryStatus(states)
                    .deliveryLogs(logs.getOrDefault(e.getExecutionId(), List.of()))
                    .build();
        }).toList();
    }

    private ReportScheduleEntity require(String scheduleId) {
        return scheduleStore.find(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ScheduleValidationException("INVALID_SCHEDULE", "'" + field + "' is required");
        }
    }
}
