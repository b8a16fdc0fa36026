package com.reportwheel.support;

import com.reportwheel.config.DeliveryGuardProperties;
import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.backoff.BackoffRegistry;
import com.reportwheel.core.cron.CronEvaluator;
import com.reportwheel.core.delivery.ArtifactRegistry;
import com.reportwheel.core.delivery.DeliveryDispatcher;
import com.reportwheel.core.delivery.GuardedChannelExecutor;
import com.reportwheel.core.engine.CancellationRegistry;
import com.reportwheel.core.engine.DueScheduleScanner;
import com.reportwheel.core.engine.ExecutionRunner;
import com.reportwheel.core.engine.ExecutionStateMachine;
import com.reportwheel.core.engine.ManualTriggerHandler;
import com.reportwheel.core.failure.RouterFailureDecider;
import com.reportwheel.core.failure.decider.BulkheadFullHandler;
import com.reportwheel.core.failure.decider.CollaboratorFailureHandler;
import com.reportwheel.core.failure.decider.OpenCircuitHandler;
import com.reportwheel.core.failure.decider.RateLimitedHandler;
import com.reportwheel.core.failure.decider.TimeoutHandler;
import com.reportwheel.core.failure.decider.UnknownHandler;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.core.retry.RetryCoordinator;
import com.reportwheel.core.serializer.JacksonPayloadSerializer;
import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.model.DeliveryConfig;
import com.reportwheel.model.DeliveryMethod;
import com.reportwheel.model.RetryPolicy;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.service.ReportScheduleService;
import com.reportwheel.service.ScheduleValidator;
import com.reportwheel.service.SchedulerDashboardService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * 用内存存储把整个引擎装配起来, 线程池同步执行, 时间轮由测试手动触发
 */
public class EngineFixture {

    public static final String NODE = "test-node";

    public final MutableClock clock;

    public final ReportWheelProperties props = new ReportWheelProperties();

    public final InMemoryScheduleStore schedules = new InMemoryScheduleStore();

    public final InMemoryExecutionStore executions = new InMemoryExecutionStore();

    public final InMemoryDeliveryStore deliveries = new InMemoryDeliveryStore();

    public final ManualResumeTimer timer = new ManualResumeTimer();

    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    public final ReportWheelMetrics meter = ReportWheelMetrics.create(registry);

    public final PayloadSerializer serializer = new JacksonPayloadSerializer();

    public final CronEvaluator cron = new CronEvaluator();

    public final ScriptedGenerator generator = new ScriptedGenerator();

    public final ScriptedChannel email = new ScriptedChannel(DeliveryMethodType.EMAIL);

    public final ScriptedChannel webhook = new ScriptedChannel(DeliveryMethodType.WEBHOOK);

    public final CancellationRegistry cancellations = new CancellationRegistry();

    public final ArtifactRegistry artifacts = new ArtifactRegistry();

    public final RetryCoordinator coordinator;

    public final ExecutionStateMachine stateMachine;

    public final DeliveryDispatcher dispatcher;

    public final ExecutionRunner runner;

    public final DueScheduleScanner scanner;

    public final ManualTriggerHandler manualTrigger;

    public final ScheduleValidator validator;

    public final ReportScheduleService service;

    public final SchedulerDashboardService dashboard;

    public EngineFixture(MutableClock clock) {
        this(clock, new DirectExecutorService());
    }

    public EngineFixture(MutableClock clock, ExecutorService generationExecutor) {
        this.clock = clock;
        TransactionOperations tt = TransactionOperations.withoutTransaction();
        NotifyingFacade notify = NotifyingFacade.disabled();
        DeliveryGuardProperties guardProps = new DeliveryGuardProperties();
        guardProps.setEnabled(false);
        List<DeliveryChannel> channels = List.of(email, webhook);

        this.coordinator = new RetryCoordinator(new BackoffRegistry(props, null), decider(), serializer, props, clock);
        this.stateMachine = new ExecutionStateMachine(schedules, executions, deliveries, coordinator, serializer,
                cancellations, tt, notify, meter, props, clock, NODE);
        this.dispatcher = new DeliveryDispatcher(deliveries, schedules, executions, channels,
                new GuardedChannelExecutor(guardProps), coordinator, artifacts, generator, serializer, timer,
                new DirectExecutorService(), notify, meter, props, clock, NODE);
        this.runner = new ExecutionRunner(new DirectExecutorService(), generationExecutor, schedules, executions,
                stateMachine, generator, dispatcher, cancellations, timer, serializer, meter, props, clock);
        this.scanner = new DueScheduleScanner(schedules, executions, stateMachine, runner, dispatcher, cron, tt,
                notify, meter, props, clock, NODE);
        this.manualTrigger = new ManualTriggerHandler(schedules, stateMachine, runner, meter, clock);
        this.validator = new ScheduleValidator(cron, channels, clock);
        this.service = new ReportScheduleService(schedules, executions, deliveries, validator, cron, manualTrigger,
                stateMachine, dispatcher, cancellations, serializer, tt, props, clock);
        this.dashboard = new SchedulerDashboardService(schedules, executions, deliveries, clock);
    }

    public static RouterFailureDecider decider() {
        return new RouterFailureDecider(List.of(
                new OpenCircuitHandler(),
                new RateLimitedHandler(),
                new BulkheadFullHandler(),
                new TimeoutHandler(),
                new CollaboratorFailureHandler(),
                new UnknownHandler()));
    }

    public static DeliveryMethod method(DeliveryMethodType type, String target) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("target", target);
        return DeliveryMethod.builder().type(type).config(config).build();
    }

    /**
     * 直接入库一个启用的调度, next_execution 为 next
     */
    public ReportScheduleEntity schedule(String cronExpression, Instant next, RetryPolicy retry, DeliveryMethod... methods) {
        Instant now = clock.instant();
        ReportScheduleEntity s = ReportScheduleEntity.builder()
                .scheduleId(UUID.randomUUID().toString())
                .reportId("sales-daily")
                .name("Daily sales")
                .cronExpression(cronExpression)
                .timezone("UTC")
                .enabled(true)
                .deliveryConfig(serializer.serialize(DeliveryConfig.builder().methods(List.of(methods)).build()))
                .retryConfig(retry == null ? null : serializer.serialize(retry))
                .nextExecution(next)
                .executionCount(0)
                .failureCount(0)
                .version(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        schedules.insert(s);
        return s;
    }

    public ReportScheduleEntity schedule(DeliveryMethod... methods) {
        return schedule("0 6 * * *", clock.instant(), null, methods);
    }

    public double counter(String name) {
        return registry.counter(name).count();
    }
}
