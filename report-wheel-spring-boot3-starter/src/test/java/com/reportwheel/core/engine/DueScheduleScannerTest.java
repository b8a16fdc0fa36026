package com.reportwheel.core.engine;

import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.model.enums.TriggerType;
import com.reportwheel.support.EngineFixture;
import com.reportwheel.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DueScheduleScannerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T06:00:00Z");

    private EngineFixture fx;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture(new MutableClock(NOW));
    }

    @Test
    void shouldClaimDueScheduleRunItAndAdvanceNextFire() {
        ReportScheduleEntity s = fx.schedule(EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));

        int created = fx.scanner.scanOnce();

        assertThat(created).isEqualTo(1);
        ReportScheduleEntity after = fx.schedules.find(s.getScheduleId()).orElseThrow();
        assertThat(after.getNextExecution()).isEqualTo(Instant.parse("2024-05-02T06:00:00Z"));
        assertThat(after.getLastExecution()).isEqualTo(NOW);
        assertThat(after.getExecutionCount()).isEqualTo(1);
        assertThat(after.getActiveExecutionId()).isNull();

        List<ScheduleExecutionEntity> runs = fx.executions.ofSchedule(s.getScheduleId());
        assertThat(runs).hasSize(1);
        ScheduleExecutionEntity run = runs.get(0);
        assertThat(run.statusEnum()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(run.getTriggerType()).isEqualTo(TriggerType.CRON.name());
        assertThat(run.getTriggeredBy()).isEqualTo(DueScheduleScanner.SCHEDULER);
        assertThat(run.getScheduledTime()).isEqualTo(NOW);
        assertThat(fx.email.calls()).hasSize(1);
        assertThat(fx.counter("report.schedule.claimed")).isEqualTo(1.0);
        // 持有旧 next_execution 的另一个领取者必然失败
        assertThat(fx.schedules.claimAndAdvance(s.getScheduleId(), NOW, Instant.parse("2024-05-02T06:00:00Z"), NOW))
                .isFalse();
    }

    @Test
    void shouldIgnoreSchedulesNotYetDueOrDisabled() {
        fx.schedule("0 6 * * *", NOW.plusSeconds(60), null, EngineFixture.method(DeliveryMethodType.EMAIL, "a@example.com"));
        ReportScheduleEntity disabled = fx.schedule(EngineFixture.method(DeliveryMethodType.EMAIL, "b@example.com"));
        fx.schedules.put(disabled.toBuilder().enabled(false).build());

        assertThat(fx.scanner.scanOnce()).isZero();
        assertThat(fx.executions.all()).isEmpty();
    }

    @Test
    void shouldNotReplayMissedFires() {
        ReportScheduleEntity s = fx.schedule("0 6 * * *", NOW.minus(Duration.ofDays(3)), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));

        assertThat(fx.scanner.scanOnce()).isEqualTo(1);
        assertThat(fx.scanner.scanOnce()).isZero();

        assertThat(fx.executions.ofSchedule(s.getScheduleId())).hasSize(1);
        assertThat(fx.schedules.find(s.getScheduleId()).orElseThrow().getNextExecution())
                .isEqualTo(Instant.parse("2024-05-02T06:00:00Z"));
    }

    @Test
    void shouldSkipFireWhilePreviousExecutionIsActive() {
        ReportScheduleEntity s = fx.schedule(EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        ScheduleExecutionEntity running = fx.stateMachine.open(s, TriggerType.MANUAL, NOW, "alice");
        fx.stateMachine.start(running);

        assertThat(fx.scanner.scanOnce()).isZero();

        ReportScheduleEntity after = fx.schedules.find(s.getScheduleId()).orElseThrow();
        assertThat(after.getActiveExecutionId()).isEqualTo(running.getExecutionId());
        assertThat(after.getNextExecution()).isEqualTo(Instant.parse("2024-05-02T06:00:00Z"));
        assertThat(fx.executions.ofSchedule(s.getScheduleId())).hasSize(1);
        assertThat(fx.counter("report.schedule.overlap.skipped")).isEqualTo(1.0);
    }

    @Test
    void shouldParkScheduleWhoseCronCannotBeEvaluated() {
        ReportScheduleEntity s = fx.schedule("bogus", NOW, null, EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));

        assertThat(fx.scanner.scanOnce()).isEqualTo(1);

        assertThat(fx.schedules.find(s.getScheduleId()).orElseThrow().getNextExecution()).isNull();
        assertThat(fx.scanner.scanOnce()).isZero();
    }

    @Test
    void shouldResumeRetryingExecutionOnceDue() {
        ReportScheduleEntity s = fx.schedule("0 6 * * *", NOW.plus(Duration.ofDays(1)), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        fx.generator.thenFail(new IllegalStateException("warehouse offline"));
        ScheduleExecutionEntity e = fx.manualTrigger.trigger(s.getScheduleId(), "alice");
        assertThat(fx.executions.find(e.getExecutionId()).orElseThrow().statusEnum()).isEqualTo(ExecutionStatus.RETRYING);

        // 时间轮丢失, 只靠扫描
        fx.timer.stop();
        assertThat(fx.scanner.resumeDueRetries()).isZero();
        fx.clock.advance(Duration.ofSeconds(5));
        assertThat(fx.scanner.resumeDueRetries()).isEqualTo(1);

        ScheduleExecutionEntity done = fx.executions.find(e.getExecutionId()).orElseThrow();
        assertThat(done.statusEnum()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(done.getRetryCount()).isEqualTo(1);
    }

    @Test
    void shouldResubmitStalePendingExecution() {
        ReportScheduleEntity s = fx.schedule("0 6 * * *", NOW.plus(Duration.ofDays(1)), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        // 创建后进程退出, 未来得及提交
        ScheduleExecutionEntity e = fx.stateMachine.open(s, TriggerType.CRON, NOW, DueScheduleScanner.SCHEDULER);

        assertThat(fx.scanner.resumeStalePending()).isZero();
        fx.clock.advance(Duration.ofMinutes(2));
        assertThat(fx.scanner.resumeStalePending()).isEqualTo(1);

        assertThat(fx.executions.find(e.getExecutionId()).orElseThrow().statusEnum()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void shouldRecoverOrphansDuringTick() {
        ReportScheduleEntity s = fx.schedule("0 6 * * *", NOW.plus(Duration.ofDays(1)), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        ScheduleExecutionEntity e = fx.stateMachine.open(s, TriggerType.CRON, NOW, DueScheduleScanner.SCHEDULER);
        fx.stateMachine.start(e);
        fx.clock.advance(Duration.ofMinutes(31));

        fx.scanner.tick();

        ScheduleExecutionEntity after = fx.executions.find(e.getExecutionId()).orElseThrow();
        assertThat(after.statusEnum()).isEqualTo(ExecutionStatus.RETRYING);
        assertThat(after.getErrorMessage()).startsWith("orphaned");
        assertThat(fx.timer.armed()).extracting(a -> a.subjectId).containsExactly(e.getExecutionId());
        assertThat(fx.counter("report.execution.orphaned")).isEqualTo(1.0);
    }
}
