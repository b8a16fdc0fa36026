package com.reportwheel.autoconfig;

import com.reportwheel.core.failure.RouterFailureDecider;
import com.reportwheel.core.failure.decider.*;
import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class FailureDeciderAutoConfiguration {

    // 内置一组异常处理器, 业务可通过 Bean 覆盖/新增
    @Bean
    @ConditionalOnMissingBean(OpenCircuitHandler.class)
    public OpenCircuitHandler openCircuitHandler() { return new OpenCircuitHandler(); }

    @Bean
    @ConditionalOnMissingBean(RateLimitedHandler.class)
    public RateLimitedHandler rateLimitedHandler() { return new RateLimitedHandler(); }

    @Bean
    @ConditionalOnMissingBean(BulkheadFullHandler.class)
    public BulkheadFullHandler bulkheadFullHandler() { return new BulkheadFullHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler() { return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(CollaboratorFailureHandler.class)
    public CollaboratorFailureHandler collaboratorFailureHandler() { return new CollaboratorFailureHandler(); }

    @Bean
    @ConditionalOnMissingBean(UnknownHandler.class)
    public UnknownHandler unknownHandler() { return new UnknownHandler(); }

    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider(List<FailureCaseHandler<?>> handlers) {
        return new RouterFailureDecider(handlers);
    }
}
