package com.reportwheel.core.engine;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.delivery.DeliveryDispatcher;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.retry.RetryDecision;
import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.core.spi.ReportGenerator;
import com.reportwheel.core.timer.ResumeTimer;
import com.reportwheel.exception.ReportGenerationException;
import com.reportwheel.model.CancellationSignal;
import com.reportwheel.model.DeliveryConfig;
import com.reportwheel.model.GenerationRequest;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.ReportConfig;
import com.reportwheel.model.WheelTask;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 执行一次报表生成: 领取 → 生成（带超时）→ 完成并派发投递 / 失败交给状态机
 */
public class ExecutionRunner {

    Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    /** 执行调度线程池（工作单元） */
    private final ExecutorService dispatchExecutor;

    /** 生成器调用线程池, 用于超时控制 */
    private final ExecutorService generationExecutor;

    private final ScheduleStore scheduleStore;

    private final ExecutionStore executionStore;

    private final ExecutionStateMachine stateMachine;

    private final ReportGenerator generator;

    private final DeliveryDispatcher dispatcher;

    private final CancellationRegistry cancellations;

    private final ResumeTimer timer;

    private final PayloadSerializer serializer;

    private final ReportWheelMetrics meter;

    private final ReportWheelProperties props;

    private final Clock clock;

    public ExecutionRunner(ExecutorService dispatchExecutor,
                           ExecutorService generationExecutor,
                           ScheduleStore scheduleStore,
                           ExecutionStore executionStore,
                           ExecutionStateMachine stateMachine,
                           ReportGenerator generator,
                           DeliveryDispatcher dispatcher,
                           CancellationRegistry cancellations,
                           ResumeTimer timer,
                           PayloadSerializer serializer,
                           ReportWheelMetrics meter,
                           ReportWheelProperties props,
                           Clock clock) {
        this.dispatchExecutor = dispatchExecutor;
        this.generationExecutor = generationExecutor;
        this.scheduleStore = scheduleStore;
        this.executionStore = executionStore;
        this.stateMachine = stateMachine;
        this.generator = generator;
        this.dispatcher = dispatcher;
        this.cancellations = cancellations;
        this.timer = timer;
        this.serializer = serializer;
        this.meter = meter;
        this.props = props;
        this.clock = clock;
    }

    /**
     * 提交到工作线程池; 重复提交由 markRunning 的 CAS 去重
     */
    public void submit(String executionId) {
        dispatchExecutor.execute(() -> {
            try {
                run(executionId);
            } catch (Throwable ex) {
                log.error("[Execution] run error id={}, {}", executionId, ex.getMessage(), ex);
                throw ex;
            }
        });
    }

    /**
     * 在时间轮上挂重试恢复, 到期重新提交
     */
    public void armRetry(String executionId, long delayMillis) {
        timer.schedule(WheelTask.Kind.EXECUTION_RETRY, executionId, delayMillis, () -> submit(executionId));
    }

    public void armRetries(Collection<ScheduleExecutionEntity> retrying) {
        Instant now = clock.instant();
        for (ScheduleExecutionEntity e : retrying) {
            long delay = e.getNextRetryTime() == null ? 0 : Duration.between(now, e.getNextRetryTime()).toMillis();
            armRetry(e.getExecutionId(), delay);
        }
    }

    void run(String executionId) {
        ScheduleExecutionEntity e = executionStore.find(executionId).orElse(null);
        if (e == null) {
            log.warn("[Execution] execution not found, skip id={}", executionId);
            return;
        }
        ExecutionStatus st = e.statusEnum();
        if (st != ExecutionStatus.PENDING && st != ExecutionStatus.RETRYING) {
            return;
        }
        Instant now = clock.instant();
        if (st == ExecutionStatus.RETRYING && e.getNextRetryTime() != null && e.getNextRetryTime().isAfter(now)) {
            // 未到恢复时间, 等时间轮或扫描
            return;
        }
        ReportScheduleEntity schedule = scheduleStore.find(e.getScheduleId()).orElse(null);
        if (schedule == null) {
            stateMachine.cancelRunning(e, "schedule deleted");
            return;
        }
        if (!stateMachine.start(e)) {
            return;
        }
        if (e.getScheduledTime() != null) {
            meter.recordLagMillis(Duration.between(e.getScheduledTime(), e.getStartTime()).toMillis());
        }

        CancellationSignal signal = cancellations.register(executionId);
        try {
            execute(e, schedule, signal);
        } finally {
            cancellations.remove(executionId);
        }
    }

    private void execute(ScheduleExecutionEntity e, ReportScheduleEntity schedule, CancellationSignal signal) {
        GenerationRequest request = buildRequest(e, schedule);
        long timeoutMs = props.getExecution().getTimeout().toMillis();
        long startNanos = System.nanoTime();
        Future<ReportArtifact> f = generationExecutor.submit(() -> generator.generate(request, signal));
        ReportArtifact artifact;
        try {
            artifact = f.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            signal.cancel("timeout");
            handleFailure(e, new TimeoutException("execution timed out after " + timeoutMs + " ms"));
            return;
        } catch (ExecutionException ee) {
            if (signal.isCancelled()) {
                stateMachine.cancelRunning(e, signal.getReason());
                return;
            }
            handleFailure(e, ee.getCause() == null ? ee : ee.getCause());
            return;
        } catch (InterruptedException ie) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            handleFailure(e, ie);
            return;
        } finally {
            meter.recordGenerationNanos(System.nanoTime() - startNanos);
        }

        if (signal.isCancelled() || cancelRequested(e)) {
            stateMachine.cancelRunning(e, signal.getReason() == null ? "cancel requested" : signal.getReason());
            return;
        }
        if (artifact == null) {
            handleFailure(e, new ReportGenerationException("Report generator returned no artifact", true));
            return;
        }
        if (stateMachine.complete(e, artifact, dispatcher.planAttempts(e, schedule))) {
            dispatcher.dispatch(e, schedule, artifact);
        }
    }

    private void handleFailure(ScheduleExecutionEntity e, Throwable cause) {
        RetryDecision d = stateMachine.fail(e, cause);
        if (d != null && d.isRetry()) {
            armRetry(e.getExecutionId(), d.getDelayMillis());
        }
    }

    /**
     * 其他节点发起的取消只落了库
     */
    private boolean cancelRequested(ScheduleExecutionEntity e) {
        return executionStore.find(e.getExecutionId())
                .map(x -> Boolean.TRUE.equals(x.getCancelRequested()))
                .orElse(false);
    }

    private GenerationRequest buildRequest(ScheduleExecutionEntity e, ReportScheduleEntity schedule) {
        DeliveryConfig dc = schedule.getDeliveryConfig() == null ? null
                : serializer.deserialize(schedule.getDeliveryConfig(), DeliveryConfig.class);
        ReportConfig rc = schedule.getReportConfig() == null ? null
                : serializer.deserialize(schedule.getReportConfig(), ReportConfig.class);
        return GenerationRequest.builder()
                .executionId(e.getExecutionId())
                .scheduleId(e.getScheduleId())
                .reportId(schedule.getReportId())
                .retryCount(e.getRetryCount())
                .scheduledTime(e.getScheduledTime())
                .reportConfig(rc)
                .format(dc == null ? null : dc.getFormat())
                .compression(dc != null && Boolean.TRUE.equals(dc.getCompression()))
                .build();
    }
}
