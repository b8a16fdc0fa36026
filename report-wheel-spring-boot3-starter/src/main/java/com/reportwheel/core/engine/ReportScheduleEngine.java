package com.reportwheel.core.engine;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.notify.NotifyContexts;
import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.core.timer.ResumeTimer;
import com.reportwheel.model.WheelTask;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.Severity;
import com.reportwheel.store.ScheduleStore;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 报表调度引擎, 持有扫描器、时间轮与各线程池的生命周期
 */
public class ReportScheduleEngine {

    Logger log = LoggerFactory.getLogger(ReportScheduleEngine.class);

    private final DueScheduleScanner scanner;

    private final ExecutionStateMachine stateMachine;

    private final ExecutionRunner runner;

    private final ScheduleStore scheduleStore;

    /** 时间轮 */
    private final ResumeTimer timer;

    /** 扫描线程池 */
    private final ScheduledExecutorService scanExecutor;

    /** 执行调度线程池 */
    private final ExecutorService dispatchExecutor;

    /** 生成器线程池 */
    private final ExecutorService generationExecutor;

    /** 投递线程池 */
    private final ExecutorService deliveryExecutor;

    private final NotifyingFacade notifyService;

    private final ReportWheelMetrics meter;

    private final ReportWheelProperties props;

    private final Clock clock;

    private final String nodeId;

    /** 引擎运行状态 */
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** 已挂起的提前唤醒时刻, 避免重复挂 */
    private final AtomicReference<Instant> armedWakeup = new AtomicReference<>();

    public ReportScheduleEngine(DueScheduleScanner scanner,
                                ExecutionStateMachine stateMachine,
                                ExecutionRunner runner,
                                ScheduleStore scheduleStore,
                                ResumeTimer timer,
                                ExecutorService dispatchExecutor,
                                ExecutorService generationExecutor,
                                ExecutorService deliveryExecutor,
                                NotifyingFacade notifyService,
                                ReportWheelMetrics meter,
                                ReportWheelProperties props,
                                Clock clock,
                                String nodeId) {
        this.scanner = scanner;
        this.stateMachine = stateMachine;
        this.runner = runner;
        this.scheduleStore = scheduleStore;
        this.timer = timer;
        this.dispatchExecutor = dispatchExecutor;
        this.generationExecutor = generationExecutor;
        this.deliveryExecutor = deliveryExecutor;
        this.notifyService = notifyService;
        this.meter = meter;
        this.props = props;
        this.clock = clock;
        this.nodeId = nodeId;
        this.scanExecutor = Executors
                .newSingleThreadScheduledExecutor(new NamedThreadFactory("report-scan-scheduler"));
    }

    public String getNodeId() { return nodeId; }

    public boolean isRunning() { return running.get(); }

    /**
     * 崩溃恢复后开始周期扫描
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            int released = stateMachine.releaseDanglingClaims();
            List<ScheduleExecutionEntity> retrying = recover();
            log.info("[Report-Wheel] recovery done, orphansRetrying={} danglingClaimsReleased={}", retrying.size(), released);
        } catch (Exception e) {
            log.error("[Report-Wheel] recovery on start failed", e);
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, "engine-recovery", e, clock), Severity.ERROR);
        }
        scanExecutor.scheduleWithFixedDelay(this::tick,
                props.getScan().getInitialDelay().toMillis(),
                props.getScan().getPeriod().toMillis(),
                TimeUnit.MILLISECONDS);
    }

    private List<ScheduleExecutionEntity> recover() {
        List<ScheduleExecutionEntity> retrying = stateMachine.recoverOrphans();
        runner.armRetries(retrying);
        return retrying;
    }

    /**
     * 单次扫描, 异常不外抛以免终止周期任务
     */
    void tick() {
        if (!running.get()) {
            log.warn("[Scanner] engine is stopped, skip scan");
            return;
        }
        try {
            scanner.tick();
            armNextWakeup();
        } catch (Exception e) {
            log.error("[Scanner] scan error", e);
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, "engine-core-scan", e, clock), Severity.ERROR);
            meter.incScanErr();
        }
    }

    /**
     * 最近一次触发早于下个扫描周期时, 在时间轮上挂一次提前扫描
     */
    private void armNextWakeup() {
        List<ReportScheduleEntity> upcoming = scheduleStore.findUpcoming(1);
        if (upcoming.isEmpty()) {
            return;
        }
        Instant at = upcoming.get(0).getNextExecution();
        Instant now = clock.instant();
        Duration period = props.getScan().getPeriod();
        if (at == null || !at.isAfter(now) || !at.isBefore(now.plus(period))) {
            return;
        }
        Instant prev = armedWakeup.get();
        if (at.equals(prev) || !armedWakeup.compareAndSet(prev, at)) {
            return;
        }
        long delay = Duration.between(now, at).toMillis();
        timer.schedule(WheelTask.Kind.SCANNER_WAKEUP, upcoming.get(0).getScheduleId(), delay, () -> {
            if (running.get() && !scanExecutor.isShutdown()) {
                scanExecutor.execute(this::tick);
            }
        });
        log.debug("[Scanner] wakeup armed in {}ms for schedule={}", delay, upcoming.get(0).getScheduleId());
    }

    public void gracefulShutdown(long awaitSecond) {
        // 停止扫描与时间轮; 未触发的恢复时间均已落库
        running.set(false);
        scanExecutor.shutdownNow();
        int pending = timer.stop();
        dispatchExecutor.shutdown();
        generationExecutor.shutdown();
        deliveryExecutor.shutdown();

        long awaitMs = Math.max(1, awaitSecond) * 1000L;
        try {
            if (!dispatchExecutor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                dispatchExecutor.shutdownNow();
                log.warn("[Report-Wheel] dispatchExecutor forced shutdown after {}s", awaitSecond);
            }
            if (!generationExecutor.awaitTermination(Math.min(2000, awaitMs), TimeUnit.MILLISECONDS)) {
                generationExecutor.shutdownNow();
                log.warn("[Report-Wheel] generationExecutor forced shutdown");
            }
            if (!deliveryExecutor.awaitTermination(awaitMs, TimeUnit.MILLISECONDS)) {
                deliveryExecutor.shutdownNow();
                log.warn("[Report-Wheel] deliveryExecutor forced shutdown after {}s", awaitSecond);
            }
        } catch (InterruptedException ie) {
            dispatchExecutor.shutdownNow();
            generationExecutor.shutdownNow();
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Report-Wheel] graceful shutdown done, pendingWheelTasks={}", pending);
    }

    public void stop() {
        gracefulShutdown(props.getShutdown().getAwait().toSeconds());
    }
}
