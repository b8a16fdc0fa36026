package com.reportwheel.autoconfig;

import com.reportwheel.annotation.EnableReportWheel;
import com.reportwheel.config.ReportNotifierProperties;
import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.backoff.BackoffRegistry;
import com.reportwheel.core.cron.CronEvaluator;
import com.reportwheel.core.delivery.ArtifactRegistry;
import com.reportwheel.core.delivery.DeliveryDispatcher;
import com.reportwheel.core.delivery.GuardedChannelExecutor;
import com.reportwheel.core.delivery.MissingReportGenerator;
import com.reportwheel.core.delivery.channel.ApiEndpointDeliveryChannel;
import com.reportwheel.core.delivery.channel.EmailDeliveryChannel;
import com.reportwheel.core.delivery.channel.FileStorageDeliveryChannel;
import com.reportwheel.core.delivery.channel.WebhookDeliveryChannel;
import com.reportwheel.core.engine.CancellationRegistry;
import com.reportwheel.core.engine.DueScheduleScanner;
import com.reportwheel.core.engine.ExecutionRunner;
import com.reportwheel.core.engine.ExecutionStateMachine;
import com.reportwheel.core.engine.ManualTriggerHandler;
import com.reportwheel.core.engine.ReportScheduleEngine;
import com.reportwheel.core.engine.ReportScheduleEngineLifecycle;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.core.retry.RetryCoordinator;
import com.reportwheel.core.serializer.JacksonPayloadSerializer;
import com.reportwheel.core.spi.BackoffPolicy;
import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.core.spi.ReportGenerator;
import com.reportwheel.core.spi.ReportMailer;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.core.timer.ResumeTimer;
import com.reportwheel.core.timer.WheelResumeTimer;
import com.reportwheel.service.ReportScheduleService;
import com.reportwheel.service.ScheduleValidator;
import com.reportwheel.service.SchedulerDashboardService;
import com.reportwheel.store.DeliveryStore;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.support.TransactionOperations;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮、线程池、调度引擎、投递通道与服务门面
 */
@AutoConfiguration(after = {
        ReportWheelMybatisAutoConfiguration.class,
        ReportTxAutoConfiguration.class,
        ReportWheelMetricsAutoConfiguration.class,
        ReportNotifierAutoConfiguration.class,
        FailureDeciderAutoConfiguration.class,
        DeliveryGuardAutoConfiguration.class
})
@EnableConfigurationProperties({
        ReportWheelProperties.class,
        ReportNotifierProperties.class
})
@ConditionalOnBean({ScheduleStore.class, ExecutionStore.class, DeliveryStore.class, TransactionOperations.class})
public class ReportWheelAutoConfiguration {

    /**
     * 时间轮, 承载执行重试、投递重试与提前唤醒扫描
     */
    @Bean(destroyMethod = "")
    public HashedWheelTimer reportWheelTimer(ReportWheelProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("report-wheel-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ResumeTimer resumeTimer(HashedWheelTimer reportWheelTimer) {
        return new WheelResumeTimer(reportWheelTimer);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock reportWheelClock() {
        return Clock.systemUTC();
    }

    /**
     * 节点标识, 仅用于日志与告警
     */
    @Bean("reportWheelNodeId")
    public String reportWheelNodeId(ApplicationContext applicationContext) {
        return applicationContext.getEnvironment().getProperty("spring.application.name", "report-wheel")
                + "-" + UUID.randomUUID();
    }

    /**
     * 执行调度线程池（工作单元）
     */
    @Bean(value = "reportDispatchExecutor", destroyMethod = "")
    public ExecutorService reportDispatchExecutor(ReportWheelProperties props) {
        ReportWheelProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("report-dispatch-exec"),
                exec.getRejectedHandler().toHandler()
        );
    }

    /**
     * 生成器调用线程池, 与工作单元一一对应
     */
    @Bean(value = "reportGenerationExecutor", destroyMethod = "")
    public ExecutorService reportGenerationExecutor(ReportWheelProperties props) {
        ReportWheelProperties.Exec exec = props.getExecutor();
        return new ThreadPoolExecutor(
                exec.getCorePoolSize(),
                exec.getMaxPoolSize(),
                exec.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                new NamedThreadFactory("report-generation-exec"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 投递线程池
     */
    @Bean(value = "reportDeliveryExecutor", destroyMethod = "")
    public ExecutorService reportDeliveryExecutor(ReportWheelProperties props) {
        ReportWheelProperties.Delivery d = props.getDelivery();
        return new ThreadPoolExecutor(
                d.getCorePoolSize(),
                d.getMaxPoolSize(),
                d.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new LinkedBlockingDeque<>(d.getQueueCapacity()),
                new NamedThreadFactory("report-delivery-exec"),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    @Bean
    public BackoffRegistry backoffRegistry(ReportWheelProperties props,
                                           @Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies);
    }

    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEvaluator cronEvaluator() {
        return new CronEvaluator();
    }

    @Bean
    public RetryCoordinator retryCoordinator(BackoffRegistry backoffRegistry, FailureDecider failureDecider,
                                             PayloadSerializer serializer, ReportWheelProperties props, Clock clock) {
        return new RetryCoordinator(backoffRegistry, failureDecider, serializer, props, clock);
    }

    @Bean
    public CancellationRegistry cancellationRegistry() {
        return new CancellationRegistry();
    }

    @Bean
    public ArtifactRegistry artifactRegistry() {
        return new ArtifactRegistry();
    }

    /**
     * 未注册生成器时执行以不可重试失败结束
     */
    @Bean
    @ConditionalOnMissingBean(ReportGenerator.class)
    public ReportGenerator missingReportGenerator() {
        return new MissingReportGenerator();
    }

    // ----------------- 投递通道 -----------------

    @Bean("reportWheelHttpClient")
    @ConditionalOnMissingBean(name = "reportWheelHttpClient")
    public HttpClient reportWheelHttpClient(ReportWheelProperties props) {
        return HttpClient.newBuilder()
                .connectTimeout(props.getDelivery().getHttpTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(EmailDeliveryChannel.class)
    public EmailDeliveryChannel emailDeliveryChannel(ObjectProvider<ReportMailer> mailer) {
        return new EmailDeliveryChannel(mailer);
    }

    @Bean
    @ConditionalOnMissingBean(FileStorageDeliveryChannel.class)
    public FileStorageDeliveryChannel fileStorageDeliveryChannel() {
        return new FileStorageDeliveryChannel();
    }

    @Bean
    @ConditionalOnMissingBean(ApiEndpointDeliveryChannel.class)
    public ApiEndpointDeliveryChannel apiEndpointDeliveryChannel(@Qualifier("reportWheelHttpClient") HttpClient client,
                                                                 ReportWheelProperties props) {
        return new ApiEndpointDeliveryChannel(client, props.getDelivery().getHttpTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(WebhookDeliveryChannel.class)
    public WebhookDeliveryChannel webhookDeliveryChannel(@Qualifier("reportWheelHttpClient") HttpClient client,
                                                         ReportWheelProperties props,
                                                         PayloadSerializer serializer) {
        return new WebhookDeliveryChannel(client, props.getDelivery().getHttpTimeout(), serializer);
    }

    // ----------------- 引擎 -----------------

    @Bean
    public ExecutionStateMachine executionStateMachine(ScheduleStore scheduleStore,
                                                       ExecutionStore executionStore,
                                                       DeliveryStore deliveryStore,
                                                       RetryCoordinator coordinator,
                                                       PayloadSerializer serializer,
                                                       CancellationRegistry cancellations,
                                                       TransactionOperations tt,
                                                       NotifyingFacade notifyService,
                                                       ReportWheelMetrics meter,
                                                       ReportWheelProperties props,
                                                       Clock clock,
                                                       @Qualifier("reportWheelNodeId") String nodeId) {
        return new ExecutionStateMachine(scheduleStore, executionStore, deliveryStore, coordinator, serializer,
                cancellations, tt, notifyService, meter, props, clock, nodeId);
    }

    @Bean
    public DeliveryDispatcher deliveryDispatcher(DeliveryStore deliveryStore,
                                                 ScheduleStore scheduleStore,
                                                 ExecutionStore executionStore,
                                                 List<DeliveryChannel> channels,
                                                 GuardedChannelExecutor guard,
                                                 RetryCoordinator coordinator,
                                                 ArtifactRegistry artifacts,
                                                 ReportGenerator generator,
                                                 PayloadSerializer serializer,
                                                 ResumeTimer timer,
                                                 @Qualifier("reportDeliveryExecutor") ExecutorService deliveryExecutor,
                                                 NotifyingFacade notifyService,
                                                 ReportWheelMetrics meter,
                                                 ReportWheelProperties props,
                                                 Clock clock,
                                                 @Qualifier("reportWheelNodeId") String nodeId) {
        return new DeliveryDispatcher(deliveryStore, scheduleStore, executionStore, channels, guard, coordinator,
                artifacts, generator, serializer, timer, deliveryExecutor, notifyService, meter, props, clock, nodeId);
    }

    @Bean
    public ExecutionRunner executionRunner(@Qualifier("reportDispatchExecutor") ExecutorService dispatchExecutor,
                                           @Qualifier("reportGenerationExecutor") ExecutorService generationExecutor,
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
        return new ExecutionRunner(dispatchExecutor, generationExecutor, scheduleStore, executionStore, stateMachine,
                generator, dispatcher, cancellations, timer, serializer, meter, props, clock);
    }

    @Bean
    public DueScheduleScanner dueScheduleScanner(ScheduleStore scheduleStore,
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
                                                 @Qualifier("reportWheelNodeId") String nodeId) {
        return new DueScheduleScanner(scheduleStore, executionStore, stateMachine, runner, dispatcher, cron, tt,
                notifyService, meter, props, clock, nodeId);
    }

    @Bean
    public ManualTriggerHandler manualTriggerHandler(ScheduleStore scheduleStore,
                                                     ExecutionStateMachine stateMachine,
                                                     ExecutionRunner runner,
                                                     ReportWheelMetrics meter,
                                                     Clock clock) {
        return new ManualTriggerHandler(scheduleStore, stateMachine, runner, meter, clock);
    }

    @Bean
    public ReportScheduleEngine reportScheduleEngine(DueScheduleScanner scanner,
                                                     ExecutionStateMachine stateMachine,
                                                     ExecutionRunner runner,
                                                     ScheduleStore scheduleStore,
                                                     ResumeTimer timer,
                                                     @Qualifier("reportDispatchExecutor") ExecutorService dispatchExecutor,
                                                     @Qualifier("reportGenerationExecutor") ExecutorService generationExecutor,
                                                     @Qualifier("reportDeliveryExecutor") ExecutorService deliveryExecutor,
                                                     NotifyingFacade notifyService,
                                                     ReportWheelMetrics meter,
                                                     ReportWheelProperties props,
                                                     Clock clock,
                                                     @Qualifier("reportWheelNodeId") String nodeId) {
        return new ReportScheduleEngine(scanner, stateMachine, runner, scheduleStore, timer, dispatchExecutor,
                generationExecutor, deliveryExecutor, notifyService, meter, props, clock, nodeId);
    }

    /**
     * 引擎启停, @EnableReportWheel 优先于配置项
     */
    @Bean
    public ReportScheduleEngineLifecycle reportScheduleEngineLifecycle(ReportScheduleEngine engine,
                                                                       ReportWheelProperties props,
                                                                       ReportNotifierProperties notifyProps,
                                                                       ApplicationContext applicationContext) {
        EnableReportWheel enable = findEnableReportWheel(applicationContext);
        if (enable != null) {
            props.getScan().setEnabled(enable.value());
        }
        return new ReportScheduleEngineLifecycle(engine, props, notifyProps);
    }

    // ----------------- 服务门面 -----------------

    @Bean
    public ScheduleValidator scheduleValidator(CronEvaluator cron, List<DeliveryChannel> channels, Clock clock) {
        return new ScheduleValidator(cron, channels, clock);
    }

    @Bean
    public ReportScheduleService reportScheduleService(ScheduleStore scheduleStore,
                                                       ExecutionStore executionStore,
                                                       DeliveryStore deliveryStore,
                                                       ScheduleValidator validator,
                                                       CronEvaluator cron,
                                                       ManualTriggerHandler manualTrigger,
                                                       ExecutionStateMachine stateMachine,
                                                       DeliveryDispatcher dispatcher,
                                                       CancellationRegistry cancellations,
                                                       PayloadSerializer serializer,
                                                       TransactionOperations tt,
                                                       ReportWheelProperties props,
                                                       Clock clock) {
        return new ReportScheduleService(scheduleStore, executionStore, deliveryStore, validator, cron, manualTrigger,
                stateMachine, dispatcher, cancellations, serializer, tt, props, clock);
    }

    @Bean
    public SchedulerDashboardService schedulerDashboardService(ScheduleStore scheduleStore,
                                                               ExecutionStore executionStore,
                                                               DeliveryStore deliveryStore,
                                                               Clock clock) {
        return new SchedulerDashboardService(scheduleStore, executionStore, deliveryStore, clock);
    }

    private EnableReportWheel findEnableReportWheel(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n);
            if (type == null) continue;
            EnableReportWheel an = type.getAnnotation(EnableReportWheel.class);
            if (an != null) return an;
        }
        return null;
    }
}
