package com.reportwheel.autoconfig;

import com.reportwheel.config.DeliveryGuardProperties;
import com.reportwheel.core.delivery.GuardedChannelExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(DeliveryGuardProperties.class)
public class DeliveryGuardAutoConfiguration {

    /**
     * 通道调用统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedChannelExecutor guardedChannelExecutor(DeliveryGuardProperties props) {
        return new GuardedChannelExecutor(props);
    }
}
