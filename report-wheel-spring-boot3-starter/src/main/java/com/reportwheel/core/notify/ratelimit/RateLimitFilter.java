package com.reportwheel.core.notify.ratelimit;

import com.reportwheel.core.spi.notify.NotifierFilter;
import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.enums.Severity;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存固定窗口限流, 维度 (事件, 调度, 级别)
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    private final Clock clock;

    private volatile long windowStart;

    private final ConcurrentHashMap<String, AtomicInteger> counter = new ConcurrentHashMap<>();

    public RateLimitFilter(Duration window, int threshold) {
        this(window, threshold, Clock.systemUTC());
    }

    public RateLimitFilter(Duration window, int threshold, Clock clock) {
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
        this.windowStart = clock.millis();
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        long now = clock.millis();
        if (now - windowStart > windowMs) {
            windowStart = now;
            counter.clear();
        }
        String key = ctx.getType() + "_" + ctx.getScheduleId() + "_" + sev.name();
        int c = counter.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        return c <= threshold;
    }
}
