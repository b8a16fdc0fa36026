package com.reportwheel.service;

import com.reportwheel.model.enums.DeliveryStatus;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.model.view.DashboardSummary;
import com.reportwheel.store.DeliveryStore;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * 看板汇总, "今天" 按 UTC 计
 */
public class SchedulerDashboardService {

    public static final int UPCOMING = 5;

    private final ScheduleStore scheduleStore;

    private final ExecutionStore executionStore;

    private final DeliveryStore deliveryStore;

    private final Clock clock;

    public SchedulerDashboardService(ScheduleStore scheduleStore, ExecutionStore executionStore,
                                     DeliveryStore deliveryStore, Clock clock) {
        this.scheduleStore = scheduleStore;
        this.executionStore = executionStore;
        this.deliveryStore = deliveryStore;
        this.clock = clock;
    }

    public DashboardSummary summary() {
        Instant startOfDay = clock.instant().truncatedTo(ChronoUnit.DAYS);

        long total = scheduleStore.count(null);
        long active = scheduleStore.count(true);

        long today = executionStore.countCreatedSince(startOfDay, null);
        long completed = executionStore.countCreatedSince(startOfDay, ExecutionStatus.COMPLETED);
        long failed = executionStore.countCreatedSince(startOfDay, ExecutionStatus.FAILED);
        long running = executionStore.countByStatus(ExecutionStatus.RUNNING);

        long deliveries = deliveryStore.countAttemptsCreatedSince(startOfDay, null);
        long delivered = deliveryStore.countAttemptsCreatedSince(startOfDay, DeliveryStatus.DELIVERED);

        return DashboardSummary.builder()
                .totalSchedules(total)
                .activeSchedules(active)
                .inactiveSchedules(total - active)
                .executionsToday(today)
                .completedToday(completed)
                .failedToday(failed)
                .runningNow(running)
                .executionSuccessRate(rate(completed, today))
                .deliveriesToday(deliveries)
                .deliveredToday(delivered)
                .deliverySuccessRate(rate(delivered, deliveries))
                .upcoming(scheduleStore.findUpcoming(UPCOMING))
                .build();
    }

    static double rate(long part, long whole) {
        if (whole <= 0) {
            return 0;
        }
        return Math.round(part * 1000.0 / whole) / 10.0;
    }
}
