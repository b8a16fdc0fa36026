package com.reportwheel.core.cron;

import com.reportwheel.exception.ScheduleValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronEvaluatorTest {

    private final CronEvaluator cron = new CronEvaluator();

    @Test
    void shouldReturnFireTimeStrictlyAfterAnchor() {
        Instant next = cron.nextFireTime("0 6 * * *", "UTC", Instant.parse("2024-01-15T06:00:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2024-01-16T06:00:00Z"));
    }

    @Test
    void shouldMatchWallClockOfScheduleTimezone() {
        // 周一 09:00 上海时间
        Instant next = cron.nextFireTime("0 9 * * 1", "Asia/Shanghai", Instant.parse("2024-01-15T00:00:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2024-01-15T01:00:00Z"));
    }

    @Test
    void shouldMoveFireInSpringForwardGapToTransition() {
        // 2024-03-10 02:30 在纽约不存在
        Instant next = cron.nextFireTime("30 2 * * *", "America/New_York", Instant.parse("2024-03-10T06:00:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2024-03-10T07:00:00Z"));
    }

    @Test
    void shouldFireOnlyOnFirstOccurrenceOfRepeatedHour() {
        Instant first = cron.nextFireTime("30 1 * * *", "America/New_York", Instant.parse("2024-11-03T04:00:00Z"));
        assertThat(first).isEqualTo(Instant.parse("2024-11-03T05:30:00Z"));

        Instant afterFirst = cron.nextFireTime("30 1 * * *", "America/New_York", first);
        assertThat(afterFirst).isEqualTo(Instant.parse("2024-11-04T06:30:00Z"));

        // 锚点落在第二次出现的 01:00 EST
        Instant fromSecondPass = cron.nextFireTime("30 1 * * *", "America/New_York", Instant.parse("2024-11-03T06:00:00Z"));
        assertThat(fromSecondPass).isEqualTo(Instant.parse("2024-11-04T06:30:00Z"));
    }

    @Test
    void shouldRejectMalformedExpression() {
        assertThatThrownBy(() -> cron.validate("not a cron"))
                .isInstanceOf(ScheduleValidationException.class)
                .extracting("code").isEqualTo("INVALID_CRON");
        assertThatThrownBy(() -> cron.validate("61 * * * *"))
                .isInstanceOf(ScheduleValidationException.class)
                .extracting("code").isEqualTo("INVALID_CRON");
        assertThatThrownBy(() -> cron.validate(" "))
                .isInstanceOf(ScheduleValidationException.class)
                .extracting("code").isEqualTo("INVALID_CRON");
    }

    @Test
    void shouldRejectUnknownTimezone() {
        assertThatThrownBy(() -> cron.nextFireTime("0 6 * * *", "Mars/Olympus", Instant.parse("2024-01-15T00:00:00Z")))
                .isInstanceOf(ScheduleValidationException.class)
                .extracting("code").isEqualTo("INVALID_TIMEZONE");
    }

    @Test
    void shouldAcceptStandardFiveFieldForms() {
        assertThat(cron.validate("*/15 * * * *")).isNotNull();
        assertThat(cron.validate("0 8-18 * * 1-5")).isNotNull();
        assertThat(cron.validateZone("Europe/Berlin").getId()).isEqualTo("Europe/Berlin");
    }
}
