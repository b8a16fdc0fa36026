package com.reportwheel.core.delivery;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.notify.NotifyContexts;
import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.core.retry.RetryCoordinator;
import com.reportwheel.core.retry.RetryDecision;
import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.core.spi.ReportGenerator;
import com.reportwheel.core.timer.ResumeTimer;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.exception.DeliveryFailedException;
import com.reportwheel.exception.DeliveryNotFoundException;
import com.reportwheel.exception.DeliveryRetryRejectedException;
import com.reportwheel.exception.ExecutionNotFoundException;
import com.reportwheel.exception.ReportGenerationException;
import com.reportwheel.model.ArtifactDescriptor;
import com.reportwheel.model.DeliveryConfig;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryMethod;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.RetryPolicy;
import com.reportwheel.model.WheelTask;
import com.reportwheel.model.ctx.FailureContext;
import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.entity.DeliveryLogEntity;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.DeliveryLogStatus;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.model.enums.DeliveryStatus;
import com.reportwheel.model.enums.Severity;
import com.reportwheel.store.DeliveryStore;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * 投递派发
 * 执行完成后每个通道独立并发投递, 各自计数各自重试; 投递失败不回退执行状态
 */
public class DeliveryDispatcher {

    Logger log = LoggerFactory.getLogger(DeliveryDispatcher.class);

    static final String LOST_ATTEMPT = "delivery attempt lost: no result recorded before lease expired";

    private final DeliveryStore deliveryStore;

    private final ScheduleStore scheduleStore;

    private final ExecutionStore executionStore;

    /** 通道实现, 按类型索引 */
    private final Map<DeliveryMethodType, DeliveryChannel> channels;

    /** 通道调用的 RL/BH/CB 包装 */
    private final GuardedChannelExecutor guard;

    private final RetryCoordinator coordinator;

    private final ArtifactRegistry artifacts;

    private final ReportGenerator generator;

    private final PayloadSerializer serializer;

    private final ResumeTimer timer;

    /** 投递线程池 */
    private final ExecutorService deliveryExecutor;

    private final NotifyingFacade notifyService;

    private final ReportWheelMetrics meter;

    private final ReportWheelProperties props;

    private final Clock clock;

    private final String nodeId;

    public DeliveryDispatcher(DeliveryStore deliveryStore,
                              ScheduleStore scheduleStore,
                              ExecutionStore executionStore,
                              List<DeliveryChannel> channels,
                              GuardedChannelExecutor guard,
                              RetryCoordinator coordinator,
                              ArtifactRegistry artifacts,
                              ReportGenerator generator,
                              PayloadSerializer serializer,
                              ResumeTimer timer,
                              ExecutorService deliveryExecutor,
                              NotifyingFacade notifyService,
                              ReportWheelMetrics meter,
                              ReportWheelProperties props,
                              Clock clock,
                              String nodeId) {
        this.deliveryStore = deliveryStore;
        this.scheduleStore = scheduleStore;
        this.executionStore = executionStore;
        this.channels = new EnumMap<>(DeliveryMethodType.class);
        for (DeliveryChannel c : channels) {
            this.channels.put(c.type(), c);
        }
        this.guard = guard;
        this.coordinator = coordinator;
        this.artifacts = artifacts;
        this.generator = generator;
        this.serializer = serializer;
        this.timer = timer;
        this.deliveryExecutor = deliveryExecutor;
        this.notifyService = notifyService;
        this.meter = meter;
        this.props = props;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    public DeliveryChannel channel(DeliveryMethodType type) {
        return channels.get(type);
    }

    /**
     * 为已完成执行的每个通道建立投递状态并提交
     * 正常路径下投递行已随 complete 落库, 这里按 (execution, channel) 幂等补插
     */
    public List<DeliveryAttemptEntity> dispatch(ScheduleExecutionEntity execution, ReportScheduleEntity schedule,
                                                ReportArtifact artifact) {
        List<DeliveryAttemptEntity> rows = planAttempts(execution, schedule);
        if (rows.isEmpty()) {
            log.warn("[Delivery] schedule={} has no delivery methods, execution={}",
                    schedule.getScheduleId(), execution.getExecutionId());
            return List.of();
        }
        artifacts.put(execution.getExecutionId(), artifact);
        try {
            deliveryStore.insertAttemptsIfAbsent(rows);
        } catch (Exception e) {
            notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, schedule.getScheduleId(),
                    execution.getExecutionId(), "insertAttempts", e, clock), Severity.ERROR);
            throw e;
        }
        List<DeliveryAttemptEntity> attempts = deliveryStore.findAttempts(execution.getExecutionId());
        attempts.stream()
                .filter(a -> a.statusEnum() == DeliveryStatus.PENDING)
                .forEach(a -> submit(a.getExecutionId(), a.getChannel()));
        log.info("[Delivery] dispatched execution={} channels={}", execution.getExecutionId(),
                attempts.stream().map(DeliveryAttemptEntity::getChannel).toList());
        return attempts;
    }

    /**
     * 每个配置通道一行 pending 投递状态, 立即到期; 只构造不落库
     */
    public List<DeliveryAttemptEntity> planAttempts(ScheduleExecutionEntity execution, ReportScheduleEntity schedule) {
        DeliveryConfig config = deliveryConfigOf(schedule);
        if (config.getMethods() == null || config.getMethods().isEmpty()) {
            return List.of();
        }
        Instant now = clock.instant();
        List<DeliveryAttemptEntity> rows = new ArrayList<>();
        for (DeliveryMethod m : config.getMethods()) {
            RetryPolicy policy = coordinator.policyOf(schedule, m);
            DeliveryChannel ch = channels.get(m.getType());
            rows.add(DeliveryAttemptEntity.builder()
                    .executionId(execution.getExecutionId())
                    .scheduleId(schedule.getScheduleId())
                    .channel(m.getType().code())
                    .recipient(ch == null ? null : ch.recipient(m.getConfig()))
                    .status(DeliveryStatus.PENDING.code)
                    .attemptCount(0)
                    .attemptBudget(Math.max(1, policy.getMaxAttempts()))
                    .nextAttemptTime(now)
                    .version(0)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        return rows;
    }

    /**
     * 兜底: 到期的 pending 通道（时间轮丢失、租约到期）
     */
    public int resumeDue() {
        List<DeliveryAttemptEntity> due = deliveryStore.findDue(clock.instant(), props.getScan().getBatch());
        due.forEach(a -> submit(a.getExecutionId(), a.getChannel()));
        return due.size();
    }

    public void submit(String executionId, String channel) {
        deliveryExecutor.execute(() -> {
            try {
                attempt(executionId, channel);
            } catch (Throwable ex) {
                log.error("[Delivery] attempt error execution={} channel={}, {}", executionId, channel, ex.getMessage(), ex);
                throw ex;
            }
        });
    }

    /**
     * 单通道一次尝试
     */
    void attempt(String executionId, String channel) {
        DeliveryAttemptEntity a = deliveryStore.findAttempt(executionId, channel).orElse(null);
        if (a == null || a.statusEnum() != DeliveryStatus.PENDING) {
            return;
        }
        Instant now = clock.instant();
        if (a.getNextAttemptTime() != null && a.getNextAttemptTime().isAfter(now)) {
            return;
        }
        if (a.getAttemptCount() >= a.getAttemptBudget()) {
            // 最后一次尝试中途崩溃, 结果未知, 按失败收尾
            String err = a.getLastError() == null ? LOST_ATTEMPT : a.getLastError();
            if (deliveryStore.markFailed(a.getId(), a.getVersion(), err)) {
                a.setVersion(a.getVersion() + 1);
                a.setStatus(DeliveryStatus.FAILED.code);
                onExhausted(a, null, new DeliveryFailedException(err, true), null);
            }
            return;
        }
        if (!deliveryStore.beginAttempt(a.getId(), a.getVersion(), now, now.plus(props.getDelivery().getLease()))) {
            return;
        }
        a.setAttemptCount(a.getAttemptCount() + 1);
        a.setLastAttemptTime(now);
        a.setVersion(a.getVersion() + 1);

        ReportScheduleEntity schedule = scheduleStore.find(a.getScheduleId()).orElse(null);
        DeliveryMethod method = schedule == null ? null
                : deliveryConfigOf(schedule).find(a.channelType()).orElse(null);
        try {
            if (method == null) {
                throw new ChannelConfigException("Delivery method " + channel + " is no longer configured");
            }
            DeliveryChannel ch = channels.get(method.getType());
            if (ch == null) {
                throw new ChannelConfigException("No delivery channel registered for " + channel);
            }
            ScheduleExecutionEntity execution = executionStore.find(executionId)
                    .orElseThrow(() -> new ExecutionNotFoundException(executionId));
            ReportArtifact artifact = resolveArtifact(execution);
            DeliveryContext ctx = DeliveryContext.builder()
                    .executionId(executionId)
                    .scheduleId(a.getScheduleId())
                    .scheduleName(schedule.getName())
                    .reportId(schedule.getReportId())
                    .channel(method.getType())
                    .attempt(a.getAttemptCount())
                    .budget(a.getAttemptBudget())
                    .scheduledTime(execution.getScheduledTime())
                    .completedAt(execution.getEndTime())
                    .build();
            DeliveryReceipt receipt = guard.execute(method.getType(), () -> ch.deliver(method.getConfig(), artifact, ctx));
            onDelivered(a, receipt);
        } catch (Exception e) {
            onFailure(a, schedule, method, e);
        }
    }

    private void onDelivered(DeliveryAttemptEntity a, DeliveryReceipt receipt) {
        Instant now = clock.instant();
        if (!deliveryStore.markDelivered(a.getId(), a.getVersion(), now)) {
            log.warn("[Delivery] delivered but state changed concurrently execution={} channel={}",
                    a.getExecutionId(), a.getChannel());
            return;
        }
        a.setStatus(DeliveryStatus.DELIVERED.code);
        a.setDeliveredAt(now);
        a.setVersion(a.getVersion() + 1);
        appendLog(a, DeliveryLogStatus.DELIVERED, null, receipt == null ? null : receipt.getMetadata());
        meter.incDelivery(a.getChannel(), "delivered");
        log.info("[Delivery] delivered execution={} channel={} attempt={}",
                a.getExecutionId(), a.getChannel(), a.getAttemptCount());
        releaseIfSettled(a.getExecutionId());
    }

    private void onFailure(DeliveryAttemptEntity a, ReportScheduleEntity schedule, DeliveryMethod method, Throwable cause) {
        RetryPolicy policy = coordinator.policyOf(schedule, method);
        FailureContext ctx = FailureContext.builder()
                .nodeId(nodeId)
                .subject(FailureContext.Subject.DELIVERY)
                .scheduleId(a.getScheduleId())
                .executionId(a.getExecutionId())
                .channel(a.getChannel())
                .used(a.getAttemptCount() - 1)
                .allowed(a.getAttemptBudget() - 1)
                .build();
        RetryDecision d = coordinator.decide(a.getAttemptCount() - 1, a.getAttemptBudget() - 1, policy, cause, ctx);
        String err = errorMessage(cause);
        try {
            if (d.isRetry()) {
                if (!deliveryStore.markRetryPending(a.getId(), a.getVersion(), d.getResumeAt(), err)) {
                    log.warn("[Delivery] retry not recorded, state changed execution={} channel={}",
                            a.getExecutionId(), a.getChannel());
                    return;
                }
                a.setNextAttemptTime(d.getResumeAt());
                a.setLastError(err);
                a.setVersion(a.getVersion() + 1);
                appendLog(a, DeliveryLogStatus.RETRYING, err, null);
                meter.incDelivery(a.getChannel(), "retrying");
                log.warn("[Delivery] attempt {}/{} failed, retry in {}ms execution={} channel={} cause={}",
                        a.getAttemptCount(), a.getAttemptBudget(), d.getDelayMillis(),
                        a.getExecutionId(), a.getChannel(), err);
                String executionId = a.getExecutionId();
                String channel = a.getChannel();
                timer.schedule(WheelTask.Kind.DELIVERY_RETRY, executionId + ":" + channel, d.getDelayMillis(),
                        () -> submit(executionId, channel));
                return;
            }
            if (!deliveryStore.markFailed(a.getId(), a.getVersion(), err)) {
                log.warn("[Delivery] failure not recorded, state changed execution={} channel={}",
                        a.getExecutionId(), a.getChannel());
                return;
            }
        } catch (Exception e) {
            notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, a.getScheduleId(), a.getExecutionId(),
                    d.isRetry() ? "markRetryPending" : "markFailed", e, clock), Severity.ERROR);
            throw e;
        }
        a.setStatus(DeliveryStatus.FAILED.code);
        a.setLastError(err);
        a.setVersion(a.getVersion() + 1);
        onExhausted(a, d, cause, err);
    }

    /**
     * 通道进入 failed 终态
     */
    private void onExhausted(DeliveryAttemptEntity a, RetryDecision d, Throwable cause, String err) {
        String error = err == null ? errorMessage(cause) : err;
        appendLog(a, DeliveryLogStatus.FAILED, error, null);
        meter.incDelivery(a.getChannel(), "failed");
        log.error("[Delivery] channel failed execution={} channel={} attempts={}/{} cause={}",
                a.getExecutionId(), a.getChannel(), a.getAttemptCount(), a.getAttemptBudget(), error);
        RetryDecision decision = d != null ? d
                : coordinator.decide(0, 0, coordinator.defaults(), cause, FailureContext.builder()
                        .nodeId(nodeId)
                        .subject(FailureContext.Subject.DELIVERY)
                        .scheduleId(a.getScheduleId())
                        .executionId(a.getExecutionId())
                        .channel(a.getChannel())
                        .build());
        notifyService.fire(NotifyContexts.ctxForDeliveryFailed(nodeId, a, decision, cause, clock), Severity.ERROR);
        releaseIfSettled(a.getExecutionId());
    }

    /**
     * 手动重试一个 failed 通道
     * fresh=true 给出完整的新预算, 否则只多给一次
     */
    public DeliveryAttemptEntity retryChannel(String executionId, DeliveryMethodType type, boolean fresh) {
        ScheduleExecutionEntity execution = executionStore.find(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        DeliveryAttemptEntity a = deliveryStore.findAttempt(executionId, type.code())
                .orElseThrow(() -> new DeliveryNotFoundException("No " + type.code()
                        + " delivery for execution " + executionId));
        if (a.statusEnum() != DeliveryStatus.FAILED) {
            throw new DeliveryRetryRejectedException("Delivery " + type.code() + " of execution " + executionId
                    + " is " + a.statusEnum().value + ", only failed deliveries can be retried");
        }
        ReportScheduleEntity schedule = scheduleStore.find(execution.getScheduleId()).orElse(null);
        DeliveryMethod method = schedule == null ? null : deliveryConfigOf(schedule).find(type).orElse(null);
        RetryPolicy policy = coordinator.policyOf(schedule, method);
        int budget = fresh
                ? a.getAttemptCount() + Math.max(1, policy.getMaxAttempts())
                : a.getAttemptCount() + 1;
        Instant now = clock.instant();
        if (!deliveryStore.reopen(a.getId(), a.getVersion(), budget, now)) {
            throw new DeliveryRetryRejectedException("Delivery " + type.code() + " of execution " + executionId
                    + " changed concurrently");
        }
        a.setStatus(DeliveryStatus.PENDING.code);
        a.setAttemptBudget(budget);
        a.setNextAttemptTime(now);
        a.setVersion(a.getVersion() + 1);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("manualRetry", true);
        meta.put("fresh", fresh);
        meta.put("budget", budget);
        appendLog(a, DeliveryLogStatus.PENDING, null, meta);
        log.info("[Delivery] manual retry execution={} channel={} fresh={} budget={}",
                executionId, type.code(), fresh, budget);
        submit(executionId, type.code());
        return a;
    }

    /**
     * 按日志行重试对应通道
     */
    public DeliveryAttemptEntity retryDeliveryLog(String logId, boolean fresh) {
        DeliveryLogEntity entry = deliveryStore.findLog(logId)
                .orElseThrow(() -> new DeliveryNotFoundException("Delivery log " + logId + " not found"));
        return retryChannel(entry.getExecutionId(), DeliveryMethodType.from(entry.getDeliveryMethod()), fresh);
    }

    private ReportArtifact resolveArtifact(ScheduleExecutionEntity execution) throws Exception {
        ReportArtifact cached = artifacts.get(execution.getExecutionId()).orElse(null);
        if (cached != null) {
            return cached;
        }
        if (execution.getExecutionMetadata() == null) {
            throw new ReportGenerationException("Execution " + execution.getExecutionId()
                    + " has no artifact metadata", false);
        }
        ArtifactDescriptor descriptor = serializer.deserialize(execution.getExecutionMetadata(), ArtifactDescriptor.class);
        ReportArtifact reloaded = generator.reload(descriptor);
        artifacts.put(execution.getExecutionId(), reloaded);
        return reloaded;
    }

    private void releaseIfSettled(String executionId) {
        boolean settled = deliveryStore.findAttempts(executionId).stream()
                .allMatch(x -> x.statusEnum().isTerminal());
        if (settled) {
            artifacts.release(executionId);
        }
    }

    private void appendLog(DeliveryAttemptEntity a, DeliveryLogStatus status, String error, Map<String, Object> metadata) {
        Instant now = clock.instant();
        DeliveryLogEntity row = DeliveryLogEntity.builder()
                .logId(UUID.randomUUID().toString())
                .executionId(a.getExecutionId())
                .scheduleId(a.getScheduleId())
                .deliveryMethod(a.getChannel())
                .recipient(a.getRecipient())
                .status(status.code)
                .attemptNumber(status == DeliveryLogStatus.PENDING ? a.getAttemptCount() + 1 : a.getAttemptCount())
                .deliveredAt(status == DeliveryLogStatus.DELIVERED ? now : null)
                .errorMessage(error)
                .deliveryMetadata(metadata == null || metadata.isEmpty() ? null : serializer.serialize(metadata))
                .createdAt(now)
                .build();
        try {
            deliveryStore.appendLog(row);
        } catch (Exception e) {
            notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, a.getScheduleId(), a.getExecutionId(),
                    "appendDeliveryLog", e, clock), Severity.ERROR);
            throw e;
        }
    }

    private DeliveryConfig deliveryConfigOf(ReportScheduleEntity schedule) {
        if (schedule.getDeliveryConfig() == null || schedule.getDeliveryConfig().isBlank()) {
            return new DeliveryConfig();
        }
        DeliveryConfig c = serializer.deserialize(schedule.getDeliveryConfig(), DeliveryConfig.class);
        return c == null ? new DeliveryConfig() : c;
    }

    private static String errorMessage(Throwable t) {
        if (t == null) {
            return null;
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }
}
