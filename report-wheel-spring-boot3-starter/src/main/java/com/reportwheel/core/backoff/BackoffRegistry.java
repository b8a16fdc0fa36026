package com.reportwheel.core.backoff;

import com.reportwheel.config.ReportWheelProperties;
import com.reportwheel.core.spi.BackoffPolicy;
import com.reportwheel.model.RetryPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - "spi:{name}" 映射到外部注册的 BackoffPolicy
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final ReportWheelProperties props;

    public BackoffRegistry(ReportWheelProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> register(p.name(), p));
        }
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent(DEFAULT, new ExponentialJitterBackoffPolicy());
    }

    public BackoffRegistry register(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析, 不存在时回落 exponential
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /**
     * 第 attempt 次重试前的等待, 使用全局配置的策略
     */
    public long delayMillis(int attempt, RetryPolicy policy) {
        return resolve(props.getRetry().getStrategy()).delayMillis(attempt, policy, props);
    }

    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        double jr = props.getRetry().getJitterRatio();
        if (jr < 0 || jr > 1) {
            throw new IllegalArgumentException("report.wheel.retry.jitter-ratio must be within [0, 1]");
        }
        if (props.getRetry().getMaxDelay().isNegative()) {
            throw new IllegalArgumentException("report.wheel.retry.max-delay must not be negative");
        }
    }
}
