package com.reportwheel.core.engine;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.notify.NotifyContexts;
import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.core.retry.RetryCoordinator;
import com.reportwheel.core.retry.RetryDecision;
import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.exception.ExecutionConflictException;
import com.reportwheel.exception.ExecutionNotFoundException;
import com.reportwheel.exception.OrphanedExecutionException;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.RetryPolicy;
import com.reportwheel.model.ctx.FailureContext;
import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.model.enums.Severity;
import com.reportwheel.model.enums.TriggerType;
import com.reportwheel.store.DeliveryStore;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 执行状态机
 * pending → running → {completed, failed, cancelled}; failed → retrying → running
 *
 * 所有迁移都是带 version 的 CAS, 返回 false 表示被并发修改, 调用方放弃本次处理
 * 进入终态时释放调度的活跃执行槽（与迁移同一事务）
 */
public class ExecutionStateMachine implements InitializingBean {

    Logger log = LoggerFactory.getLogger(ExecutionStateMachine.class);

    private static final int MAX_CANCEL_SPINS = 3;

    private final ScheduleStore scheduleStore;

    private final ExecutionStore executionStore;

    private final DeliveryStore deliveryStore;

    private final RetryCoordinator coordinator;

    private final PayloadSerializer serializer;

    private final CancellationRegistry cancellations;

    /** 编程式事务 */
    private final TransactionOperations tt;

    private final NotifyingFacade notifyService;

    private final ReportWheelMetrics meter;

    private final ReportWheelProperties props;

    private final Clock clock;

    private final String nodeId;

    public ExecutionStateMachine(ScheduleStore scheduleStore,
                                 ExecutionStore executionStore,
                                 DeliveryStore deliveryStore,
                                 RetryCoordinator coordinator,
                                 PayloadSerializer serializer,
                                 CancellationRegistry cancellations,
                                 TransactionOperations tt,
                                 NotifyingFacade notifyService,
                                 ReportWheelMetrics meter,
                                 ReportWheelProperties props,
                                 Clock clock,
                                 String nodeId) {
        this.scheduleStore = scheduleStore;
        this.executionStore = executionStore;
        this.deliveryStore = deliveryStore;
        this.coordinator = coordinator;
        this.serializer = serializer;
        this.cancellations = cancellations;
        this.tt = tt;
        this.notifyService = notifyService;
        this.meter = meter;
        this.props = props;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    /**
     * 占用活跃执行槽并创建 pending 执行
     *
     * @return 调度已有非终态执行或已停用时返回 null
     */
    public ScheduleExecutionEntity open(ReportScheduleEntity schedule, TriggerType trigger,
                                        Instant scheduledTime, String triggeredBy) {
        Instant now = clock.instant();
        String executionId = UUID.randomUUID().toString();
        RetryPolicy policy = coordinator.policyOf(schedule);
        return tt.execute(status -> {
            if (!scheduleStore.acquireActive(schedule.getScheduleId(), executionId, now)) {
                return null;
            }
            ScheduleExecutionEntity e = ScheduleExecutionEntity.builder()
                    .executionId(executionId)
                    .scheduleId(schedule.getScheduleId())
                    .status(ExecutionStatus.PENDING.code)
                    .triggerType(trigger.name())
                    .triggeredBy(triggeredBy)
                    .scheduledTime(scheduledTime)
                    .retryCount(0)
                    .maxAttempts(Math.max(0, policy.getMaxAttempts()))
                    .cancelRequested(false)
                    .version(0)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            try {
                executionStore.insert(e);
            } catch (Exception ex) {
                notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, schedule.getScheduleId(), executionId,
                        "insertExecution", ex, clock), Severity.ERROR);
                throw ex;
            }
            log.info("[Execution] opened id={} schedule={} trigger={} by={}",
                    executionId, schedule.getScheduleId(), trigger, triggeredBy);
            return e;
        });
    }

    /**
     * pending | retrying → running
     */
    public boolean start(ScheduleExecutionEntity e) {
        Instant now = clock.instant();
        boolean ok;
        try {
            ok = executionStore.markRunning(e.getExecutionId(), e.getVersion(), now);
        } catch (Exception ex) {
            notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, e.getScheduleId(), e.getExecutionId(),
                    "markRunning", ex, clock), Severity.ERROR);
            throw ex;
        }
        if (!ok) {
            log.debug("[Execution] start lost race, id={} version={}", e.getExecutionId(), e.getVersion());
            return false;
        }
        e.setStatus(ExecutionStatus.RUNNING.code);
        e.setStartTime(now);
        e.setNextRetryTime(null);
        e.setVersion(e.getVersion() + 1);
        return true;
    }

    public boolean complete(ScheduleExecutionEntity e, ReportArtifact artifact) {
        return complete(e, artifact, List.of());
    }

    /**
     * running → completed, 释放活跃执行槽
     * 投递行与完成状态同一事务落库, 提交后崩溃由投递兜底扫描接续
     */
    public boolean complete(ScheduleExecutionEntity e, ReportArtifact artifact, List<DeliveryAttemptEntity> deliveries) {
        Instant now = clock.instant();
        long duration = durationMillis(e, now);
        String metadata = serializer.serialize(artifact.descriptor());
        Boolean ok = tt.execute(status -> {
            String op = "markCompleted";
            try {
                if (!executionStore.markCompleted(e.getExecutionId(), e.getVersion(), now, duration,
                        artifact.getReportExecutionId(), metadata)) {
                    return false;
                }
                if (!deliveries.isEmpty()) {
                    op = "insertAttempts";
                    deliveryStore.insertAttemptsIfAbsent(deliveries);
                }
                op = "releaseActive";
                scheduleStore.releaseActive(e.getScheduleId(), e.getExecutionId());
                return true;
            } catch (RuntimeException ex) {
                notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, e.getScheduleId(), e.getExecutionId(),
                        op, ex, clock), Severity.ERROR);
                throw ex;
            }
        });
        if (!Boolean.TRUE.equals(ok)) {
            log.warn("[Execution] complete skipped, execution changed concurrently id={}", e.getExecutionId());
            return false;
        }
        e.setStatus(ExecutionStatus.COMPLETED.code);
        e.setEndTime(now);
        e.setDuration(duration);
        e.setReportExecutionId(artifact.getReportExecutionId());
        e.setExecutionMetadata(metadata);
        e.setErrorMessage(null);
        e.setVersion(e.getVersion() + 1);
        meter.incCompleted();
        log.info("[Execution] completed id={} schedule={} duration={}ms", e.getExecutionId(), e.getScheduleId(), duration);
        return true;
    }

    /**
     * running → failed, 交给 Coordinator:
     * 可重试 → retrying（retry_count + 1, 记录恢复时间）; 否则保持 failed, 调度 failure_count + 1 并释放槽
     *
     * @return 决策; 执行已被并发修改时返回 null
     */
    public RetryDecision fail(ScheduleExecutionEntity e, Throwable cause) {
        Instant now = clock.instant();
        Long duration = e.getStartTime() == null ? null : durationMillis(e, now);
        String error = errorMessage(cause);
        ReportScheduleEntity schedule = scheduleStore.find(e.getScheduleId()).orElse(null);
        RetryPolicy policy = coordinator.policyOf(schedule);
        FailureContext ctx = FailureContext.builder()
                .nodeId(nodeId)
                .subject(FailureContext.Subject.EXECUTION)
                .scheduleId(e.getScheduleId())
                .executionId(e.getExecutionId())
                .used(e.getRetryCount())
                .allowed(e.getMaxAttempts())
                .build();

        RetryDecision decision = tt.execute(status -> {
            String op = "markFailed";
            try {
                if (!executionStore.markFailed(e.getExecutionId(), e.getVersion(), now, duration, error)) {
                    return null;
                }
                int failedVersion = e.getVersion() + 1;
                RetryDecision d = coordinator.decide(e.getRetryCount(), e.getMaxAttempts(), policy, cause, ctx);
                if (d.isRetry()) {
                    op = "markRetrying";
                    if (!executionStore.markRetrying(e.getExecutionId(), failedVersion, d.getResumeAt())) {
                        throw new IllegalStateException("execution " + e.getExecutionId() + " changed between fail and retry");
                    }
                } else {
                    op = "releaseActive";
                    scheduleStore.incrementFailureCount(e.getScheduleId());
                    scheduleStore.releaseActive(e.getScheduleId(), e.getExecutionId());
                }
                return d;
            } catch (RuntimeException ex) {
                notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, e.getScheduleId(), e.getExecutionId(),
                        op, ex, clock), Severity.ERROR);
                throw ex;
            }
        });
        if (decision == null) {
            log.warn("[Execution] fail skipped, execution changed concurrently id={}", e.getExecutionId());
            return null;
        }

        e.setEndTime(now);
        e.setDuration(duration);
        e.setErrorMessage(error);
        if (decision.isRetry()) {
            e.setStatus(ExecutionStatus.RETRYING.code);
            e.setRetryCount(e.getRetryCount() + 1);
            e.setNextRetryTime(decision.getResumeAt());
            e.setVersion(e.getVersion() + 2);
            meter.incRetried();
            log.warn("[Execution] failed, retry {}/{} in {}ms id={} cause={}", e.getRetryCount(), e.getMaxAttempts(),
                    decision.getDelayMillis(), e.getExecutionId(), error);
        } else {
            e.setStatus(ExecutionStatus.FAILED.code);
            e.setVersion(e.getVersion() + 1);
            meter.incFailed();
            log.error("[Execution] permanently failed id={} schedule={} reason={} cause={}",
                    e.getExecutionId(), e.getScheduleId(), decision.reasonCode(), error);
            notifyService.fire(NotifyContexts.ctxForExecutionFailed(nodeId, e, decision, cause, clock), Severity.ERROR);
        }
        return decision;
    }

    /**
     * 取消: pending/retrying 直接取消; running 置取消标记并通知生成器; 终态拒绝
     *
     * @return 最新状态
     */
    public ScheduleExecutionEntity cancel(String executionId, String reason) {
        for (int i = 0; i < MAX_CANCEL_SPINS; i++) {
            ScheduleExecutionEntity e = executionStore.find(executionId)
                    .orElseThrow(() -> new ExecutionNotFoundException(executionId));
            ExecutionStatus st = e.statusEnum();
            if (st.isTerminal()) {
                throw new ExecutionConflictException("Execution " + executionId + " is already " + st.value);
            }
            if (st == ExecutionStatus.RUNNING) {
                executionStore.requestCancel(executionId);
                boolean local = cancellations.signal(executionId, reason);
                e.setCancelRequested(true);
                log.info("[Execution] cancel requested id={} local={} reason={}", executionId, local, reason);
                return e;
            }
            if (cancelQuietly(e, reason)) {
                return e;
            }
        }
        throw new ExecutionConflictException("Execution " + executionId + " changed concurrently, cancel not applied");
    }

    /**
     * 运行中的执行在生成器返回后确认取消
     */
    public boolean cancelRunning(ScheduleExecutionEntity e, String reason) {
        return cancelQuietly(e, reason);
    }

    private boolean cancelQuietly(ScheduleExecutionEntity e, String reason) {
        Instant now = clock.instant();
        Boolean ok = tt.execute(status -> {
            try {
                if (!executionStore.markCancelled(e.getExecutionId(), e.getVersion(), now, reason)) {
                    return false;
                }
                scheduleStore.releaseActive(e.getScheduleId(), e.getExecutionId());
                return true;
            } catch (Exception ex) {
                notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, e.getScheduleId(), e.getExecutionId(),
                        "markCancelled", ex, clock), Severity.ERROR);
                throw ex;
            }
        });
        if (!Boolean.TRUE.equals(ok)) {
            return false;
        }
        e.setStatus(ExecutionStatus.CANCELLED.code);
        e.setEndTime(now);
        e.setErrorMessage(reason);
        e.setNextRetryTime(null);
        e.setVersion(e.getVersion() + 1);
        meter.incCancelled();
        log.info("[Execution] cancelled id={} reason={}", e.getExecutionId(), reason);
        return true;
    }

    /**
     * 崩溃恢复: start_time 早于 staleThreshold 的 running 执行按可重试失败处理
     *
     * @return 已转入 retrying 的执行, 由调用方挂时间轮
     */
    public List<ScheduleExecutionEntity> recoverOrphans() {
        Duration stale = props.getExecution().getStaleThreshold();
        Instant startedBefore = clock.instant().minus(stale);
        List<ScheduleExecutionEntity> orphans = executionStore.findStaleRunning(startedBefore, props.getScan().getBatch());
        List<ScheduleExecutionEntity> retrying = new ArrayList<>();
        for (ScheduleExecutionEntity e : orphans) {
            log.warn("[Execution] orphan detected id={} schedule={} startTime={}",
                    e.getExecutionId(), e.getScheduleId(), e.getStartTime());
            meter.incOrphaned();
            notifyService.fire(NotifyContexts.ctxForOrphan(nodeId, e, clock), Severity.WARNING);
            RetryDecision d = fail(e, new OrphanedExecutionException());
            if (d != null && d.isRetry()) {
                retrying.add(e);
            }
        }
        if (!orphans.isEmpty()) {
            log.info("[Execution] orphan recovery done, found={} retrying={}", orphans.size(), retrying.size());
        }
        return retrying;
    }

    /**
     * 活跃槽指向不存在或已终结的执行时释放; 按 schedule_id 翻页直到扫完
     */
    public int releaseDanglingClaims() {
        int batch = props.getScan().getBatch();
        int released = 0;
        String cursor = null;
        while (true) {
            List<ReportScheduleEntity> page = scheduleStore.findClaimed(cursor, batch);
            for (ReportScheduleEntity s : page) {
                String active = s.getActiveExecutionId();
                boolean dangling = executionStore.find(active)
                        .map(e -> e.statusEnum().isTerminal())
                        .orElse(true);
                if (dangling && scheduleStore.releaseActive(s.getScheduleId(), active)) {
                    released++;
                    log.warn("[Execution] released dangling claim schedule={} execution={}", s.getScheduleId(), active);
                }
            }
            if (page.size() < batch) {
                return released;
            }
            cursor = page.get(page.size() - 1).getScheduleId();
        }
    }

    /**
     * 孤儿阈值必须大于生成超时
     */
    @Override
    public void afterPropertiesSet() {
        Duration timeout = props.getExecution().getTimeout();
        Duration stale = props.getExecution().getStaleThreshold();
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("report.wheel.execution.timeout must be positive");
        }
        if (stale == null || stale.compareTo(timeout) <= 0) {
            throw new IllegalArgumentException("report.wheel.execution.stale-threshold (" + stale
                    + ") must exceed report.wheel.execution.timeout (" + timeout + ")");
        }
    }

    private long durationMillis(ScheduleExecutionEntity e, Instant end) {
        return e.getStartTime() == null ? 0L : Math.max(0L, Duration.between(e.getStartTime(), end).toMillis());
    }

    static String errorMessage(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }
}
