package com.reportwheel.core.engine;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.cron.CronEvaluator;
import com.reportwheel.core.delivery.DeliveryDispatcher;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.notify.NotifyContexts;
import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.Severity;
import com.reportwheel.model.enums.TriggerType;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 到期调度扫描
 * 行锁 + claim-and-advance 保证一次到期只产生一个执行; 错过的触发不补偿
 */
public class DueScheduleScanner {

    Logger log = LoggerFactory.getLogger(DueScheduleScanner.class);

    public static final String SCHEDULER = "scheduler";

    private final ScheduleStore scheduleStore;

    private final ExecutionStore executionStore;

    private final ExecutionStateMachine stateMachine;

    private final ExecutionRunner runner;

    private final DeliveryDispatcher dispatcher;

    private final CronEvaluator cron;

    private final TransactionOperations tt;

    private final NotifyingFacade notifyService;

    private final ReportWheelMetrics meter;

    private final ReportWheelProperties props;

    private final Clock clock;

    private final String nodeId;

    public DueScheduleScanner(ScheduleStore scheduleStore,
                              ExecutionStore executionStore,
                              ExecutionStateMachine stateMachine,
                              ExecutionRunner runner,
                              DeliveryDispatcher dispatcher,
                              CronEvaluator cron,
                              TransactionOperations tt,
                              NotifyingFacade notifyService,
                              ReportWheelMetrics meter,
                              ReportWheelProperties props,
                              Clock clock,
                              String nodeId) {
        this.scheduleStore = scheduleStore;
        this.executionStore = executionStore;
        this.stateMachine = stateMachine;
        this.runner = runner;
        this.dispatcher = dispatcher;
        this.cron = cron;
        this.tt = tt;
        this.notifyService = notifyService;
        this.meter = meter;
        this.props = props;
        this.clock = clock;
        this.nodeId = nodeId;
    }

    /**
     * 一次完整扫描
     */
    public void tick() {
        scanOnce();
        resumeDueRetries();
        resumeStalePending();
        resumeDueDeliveries();
        runner.armRetries(stateMachine.recoverOrphans());
    }

    /**
     * 领取到期调度并创建执行, 事务提交后再提交到工作线程池
     *
     * @return 创建的执行数
     */
    public int scanOnce() {
        Instant now = clock.instant();
        List<ScheduleExecutionEntity> created = tt.execute(status -> {
            List<ReportScheduleEntity> due = scheduleStore.lockDue(now, props.getScan().getBatch());
            List<ScheduleExecutionEntity> out = new ArrayList<>(due.size());
            for (ReportScheduleEntity s : due) {
                if (!Boolean.TRUE.equals(s.getEnabled())) {
                    continue;
                }
                Instant firedFor = s.getNextExecution();
                Instant next = nextFire(s, now);
                try {
                    if (!scheduleStore.claimAndAdvance(s.getScheduleId(), firedFor, next, now)) {
                        log.debug("[Scanner] claim lost schedule={}", s.getScheduleId());
                        continue;
                    }
                } catch (Exception e) {
                    notifyService.fire(NotifyContexts.ctxForPersistFail(nodeId, s.getScheduleId(), null,
                            "claimAndAdvance", e, clock), Severity.ERROR);
                    throw e;
                }
                meter.incClaimed();
                ScheduleExecutionEntity e = stateMachine.open(s, TriggerType.CRON, firedFor, SCHEDULER);
                if (e == null) {
                    meter.incOverlapSkipped();
                    log.warn("[Scanner] schedule={} fire {} skipped, execution {} still active, next={}",
                            s.getScheduleId(), firedFor, s.getActiveExecutionId(), next);
                    notifyService.fire(NotifyContexts.ctxForOverlap(nodeId, s, s.getActiveExecutionId(), clock),
                            Severity.WARNING);
                    continue;
                }
                out.add(e);
            }
            return out;
        });
        if (created == null || created.isEmpty()) {
            return 0;
        }
        created.forEach(e -> runner.submit(e.getExecutionId()));
        log.info("[Scanner] claimed {} due schedules", created.size());
        return created.size();
    }

    /**
     * 到期的 retrying 执行（时间轮丢失或其他节点挂起的）
     */
    public int resumeDueRetries() {
        List<ScheduleExecutionEntity> due = executionStore.findDueRetries(clock.instant(), props.getScan().getBatch());
        due.forEach(e -> runner.submit(e.getExecutionId()));
        return due.size();
    }

    /**
     * 创建后未能提交的 pending 执行
     */
    public int resumeStalePending() {
        Instant createdBefore = clock.instant().minus(props.getExecution().getPendingGrace());
        List<ScheduleExecutionEntity> stale = executionStore.findStalePending(createdBefore, props.getScan().getBatch());
        stale.forEach(e -> runner.submit(e.getExecutionId()));
        return stale.size();
    }

    public int resumeDueDeliveries() {
        return dispatcher.resumeDue();
    }

    /**
     * 以 now 为锚点计算下一次触发; 表达式已无法触发时返回 null, 调度不再到期
     */
    private Instant nextFire(ReportScheduleEntity s, Instant now) {
        try {
            return cron.nextFireTime(s.getCronExpression(), s.getTimezone(), now);
        } catch (RuntimeException e) {
            log.error("[Scanner] schedule={} cron '{}' cannot produce next fire time, parked: {}",
                    s.getScheduleId(), s.getCronExpression(), e.getMessage());
            notifyService.fire(NotifyContexts.ctxForEngineError(nodeId, "scanner-cron", e, clock), Severity.ERROR);
            return null;
        }
    }
}
