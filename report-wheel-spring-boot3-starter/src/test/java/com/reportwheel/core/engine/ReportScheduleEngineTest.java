package com.reportwheel.core.engine;

import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.model.WheelTask;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.model.enums.TriggerType;
import com.reportwheel.support.DirectExecutorService;
import com.reportwheel.support.EngineFixture;
import com.reportwheel.support.ManualResumeTimer;
import com.reportwheel.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReportScheduleEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T06:00:40Z");

    private MutableClock clock;

    private EngineFixture fx;

    private ReportScheduleEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        fx = new EngineFixture(clock);
        // 周期扫描推迟到测试结束之后, tick 由测试直接调用
        fx.props.getScan().setInitialDelay(Duration.ofHours(1));
        engine = new ReportScheduleEngine(fx.scanner, fx.stateMachine, fx.runner, fx.schedules, fx.timer,
                new DirectExecutorService(), new DirectExecutorService(), new DirectExecutorService(),
                NotifyingFacade.disabled(), fx.meter, fx.props, clock, EngineFixture.NODE);
    }

    @AfterEach
    void tearDown() {
        engine.gracefulShutdown(1);
    }

    @Test
    void shouldArmEarlyWakeupForFireInsideScanPeriod() {
        fx.schedule("* * * * *", Instant.parse("2024-05-01T06:01:00Z"), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        engine.start();

        engine.tick();
        engine.tick();

        List<ManualResumeTimer.Armed> wakeups = fx.timer.armed(WheelTask.Kind.SCANNER_WAKEUP);
        assertThat(wakeups).hasSize(1);
        assertThat(wakeups.get(0).delayMillis).isEqualTo(20_000);
    }

    @Test
    void shouldNotArmWakeupForDistantFire() {
        fx.schedule("0 6 * * *", Instant.parse("2024-05-02T06:00:00Z"), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        engine.start();

        engine.tick();

        assertThat(fx.timer.armed(WheelTask.Kind.SCANNER_WAKEUP)).isEmpty();
    }

    @Test
    void shouldRunDueScheduleOnTick() {
        ReportScheduleEntity s = fx.schedule("* * * * *", Instant.parse("2024-05-01T06:00:00Z"), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        engine.start();

        engine.tick();

        assertThat(fx.executions.ofSchedule(s.getScheduleId()))
                .singleElement()
                .satisfies(e -> assertThat(e.statusEnum()).isEqualTo(ExecutionStatus.COMPLETED));
        assertThat(fx.schedules.find(s.getScheduleId()).orElseThrow().getNextExecution())
                .isEqualTo(Instant.parse("2024-05-01T06:01:00Z"));
    }

    @Test
    void shouldRecoverOrphansAndReleaseClaimsOnStart() {
        ReportScheduleEntity s = fx.schedule(EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        ScheduleExecutionEntity e = fx.stateMachine.open(s, TriggerType.CRON, NOW, DueScheduleScanner.SCHEDULER);
        fx.stateMachine.start(e);
        clock.advance(Duration.ofHours(1));

        engine.start();

        ScheduleExecutionEntity recovered = fx.executions.find(e.getExecutionId()).orElseThrow();
        assertThat(recovered.statusEnum()).isEqualTo(ExecutionStatus.RETRYING);
        assertThat(fx.timer.armed(WheelTask.Kind.EXECUTION_RETRY)).hasSize(1);
        assertThat(fx.counter("report.execution.orphaned")).isEqualTo(1.0);
    }

    @Test
    void shouldSkipTickOnceStopped() {
        ReportScheduleEntity s = fx.schedule("* * * * *", Instant.parse("2024-05-01T06:00:00Z"), null,
                EngineFixture.method(DeliveryMethodType.EMAIL, "ops@example.com"));
        engine.start();
        engine.gracefulShutdown(1);

        engine.tick();

        assertThat(engine.isRunning()).isFalse();
        assertThat(fx.executions.ofSchedule(s.getScheduleId())).isEmpty();
    }
}
