package com.reportwheel.autoconfig;

import com.reportwheel.core.metric.ReportWheelMeterRegistryProvider;
import com.reportwheel.core.metric.ReportWheelMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class ReportWheelMetricsAutoConfiguration {

    @Bean
    public ReportWheelMeterRegistryProvider reportWheelMeterRegistryProvider(List<MeterRegistry> discovered) {
        return new ReportWheelMeterRegistryProvider(discovered);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReportWheelMetrics reportWheelMetrics(ReportWheelMeterRegistryProvider provider) {
        return ReportWheelMetrics.create(provider.getRegistry());
    }
}
