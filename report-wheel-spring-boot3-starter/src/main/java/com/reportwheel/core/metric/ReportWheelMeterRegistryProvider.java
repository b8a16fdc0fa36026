package com.reportwheel.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 本地 Simple 注册表 + 应用已有的注册表
 */
public class ReportWheelMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public ReportWheelMeterRegistryProvider(List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());
        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    c.getRegistries().forEach(this.composite::add);
                } else {
                    this.composite.add(mr);
                }
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
