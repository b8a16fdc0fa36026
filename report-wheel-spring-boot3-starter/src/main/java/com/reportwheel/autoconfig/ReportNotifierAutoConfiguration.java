package com.reportwheel.autoconfig;

import com.reportwheel.config.ReportNotifierProperties;
import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.notify.AsyncNotifyingService;
import com.reportwheel.core.notify.NotifyingFacade;
import com.reportwheel.core.notify.notifier.LoggingNotifier;
import com.reportwheel.core.notify.ratelimit.RateLimitFilter;
import com.reportwheel.core.notify.route.SimpleRouter;
import com.reportwheel.core.spi.notify.Notifier;
import com.reportwheel.core.spi.notify.NotifierRouter;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@AutoConfiguration(after = ReportWheelMetricsAutoConfiguration.class)
@EnableConfigurationProperties(ReportNotifierProperties.class)
public class ReportNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    /**
     * 日志通知器之外的 Notifier Bean 一并路由
     */
    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(@Qualifier("loggingNotifier") Notifier logging,
                                         ObjectProvider<Notifier> all) {
        List<Notifier> extra = all.orderedStream()
                .filter(n -> n != logging)
                .collect(Collectors.toList());
        return new SimpleRouter(logging, extra);
    }

    @Bean
    @ConditionalOnProperty(prefix = "report.wheel.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       ReportWheelMetrics metrics,
                                                       ReportNotifierProperties props) {
        ReportNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                new NamedThreadFactory("report-notify"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        RateLimitFilter filter = new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
        return new AsyncNotifyingService(exec, router, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
