package com.reportwheel.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class ReportWheelMetrics {
    private final MeterRegistry reg;
    private final Counter claimed;
    private final Counter overlapSkipped;
    private final Counter manualTriggered;
    private final Counter completed;
    private final Counter failed;
    private final Counter retried;
    private final Counter cancelled;
    private final Counter orphaned;
    private final Counter scanErr;
    private final Counter notifySuppressed;
    private final Counter notifySent;
    private final Counter notifyFailed;
    private final Timer generationTimer;
    private final Timer lagTimer;

    private ReportWheelMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.claimed = Counter.builder("report.schedule.claimed").description("due schedules claimed by the scanner").register(reg);
        this.overlapSkipped = Counter.builder("report.schedule.overlap.skipped").description("fires skipped, previous run still active").register(reg);
        this.manualTriggered = Counter.builder("report.schedule.manual").description("manual triggers accepted").register(reg);
        this.completed = Counter.builder("report.execution.completed").description("executions completed").register(reg);
        this.failed = Counter.builder("report.execution.failed").description("executions permanently failed").register(reg);
        this.retried = Counter.builder("report.execution.retried").description("execution retries scheduled").register(reg);
        this.cancelled = Counter.builder("report.execution.cancelled").description("executions cancelled").register(reg);
        this.orphaned = Counter.builder("report.execution.orphaned").description("orphaned executions recovered").register(reg);
        this.scanErr = Counter.builder("report.scan.error").description("scanner tick errors").register(reg);
        this.notifySuppressed = Counter.builder("report.notify.suppressed").description("notify suppressed").register(reg);
        this.notifySent = Counter.builder("report.notify.sent").description("notify sent").register(reg);
        this.notifyFailed = Counter.builder("report.notify.failed").description("notify failed").register(reg);
        this.generationTimer = Timer.builder("report.generation.time").description("report generation time").register(reg);
        this.lagTimer = Timer.builder("report.schedule.lag").description("time from scheduled fire to start").register(reg);
    }

    public static ReportWheelMetrics create(MeterRegistry reg) { return new ReportWheelMetrics(reg); }

    public void incClaimed() { claimed.increment(); }
    public void incOverlapSkipped() { overlapSkipped.increment(); }
    public void incManualTriggered() { manualTriggered.increment(); }
    public void incCompleted() { completed.increment(); }
    public void incFailed() { failed.increment(); }
    public void incRetried() { retried.increment(); }
    public void incCancelled() { cancelled.increment(); }
    public void incOrphaned() { orphaned.increment(); }
    public void incScanErr() { scanErr.increment(); }
    public void incNotifySuppressed() { notifySuppressed.increment(); }
    public void incNotifySent() { notifySent.increment(); }
    public void incNotifyFailed() { notifyFailed.increment(); }

    /** 按通道与结果计数: delivered | retrying | failed */
    public void incDelivery(String channel, String outcome) {
        Counter.builder("report.delivery")
                .tag("channel", channel)
                .tag("outcome", outcome)
                .register(reg)
                .increment();
    }

    public void recordGenerationNanos(long nanos) { generationTimer.record(nanos, TimeUnit.NANOSECONDS); }
    public void recordLagMillis(long millis) { lagTimer.record(Math.max(0, millis), TimeUnit.MILLISECONDS); }
}
