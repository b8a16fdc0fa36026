package com.reportwheel.service;

import com.reportwheel.core.cron.CronEvaluator;
import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.exception.ScheduleValidationException;
import com.reportwheel.model.DeliveryConfig;
import com.reportwheel.model.DeliveryMethod;
import com.reportwheel.model.RetryPolicy;
import com.reportwheel.model.enums.DeliveryMethodType;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 创建/更新调度时的同步校验
 */
public class ScheduleValidator {

    private final CronEvaluator cron;

    private final Clock clock;

    private final Map<DeliveryMethodType, DeliveryChannel> channels = new EnumMap<>(DeliveryMethodType.class);

    public ScheduleValidator(CronEvaluator cron, List<DeliveryChannel> channels, Clock clock) {
        this.cron = cron;
        this.clock = clock;
        channels.forEach(c -> this.channels.put(c.type(), c));
    }

    public void validateCron(String expression, String timezone) {
        cron.validate(expression);
        cron.validateZone(timezone);
        // 能解析但永不触发的表达式同样拒绝
        cron.nextFireTime(expression, timezone, clock.instant());
    }

    public void validateDelivery(DeliveryConfig config) {
        if (config == null || config.getMethods() == null || config.getMethods().isEmpty()) {
            throw new ScheduleValidationException("EMPTY_DELIVERY", "At least one delivery method is required");
        }
        Set<DeliveryMethodType> seen = EnumSet.noneOf(DeliveryMethodType.class);
        for (DeliveryMethod m : config.getMethods()) {
            if (m == null || m.getType() == null) {
                throw new ScheduleValidationException("INVALID_DELIVERY", "Delivery method type is required");
            }
            if (!seen.add(m.getType())) {
                throw new ScheduleValidationException("DUPLICATE_DELIVERY",
                        "Delivery method " + m.getType().code() + " is configured more than once");
            }
            DeliveryChannel ch = channels.get(m.getType());
            if (ch == null) {
                throw new ScheduleValidationException("INVALID_DELIVERY",
                        "Delivery method " + m.getType().code() + " is not available");
            }
            try {
                ch.validate(m.getConfig());
            } catch (ChannelConfigException e) {
                throw new ScheduleValidationException("INVALID_DELIVERY",
                        "Invalid " + m.getType().code() + " config: " + e.getMessage(), e);
            }
            if (m.getRetry() != null) {
                validateRetry(m.getRetry());
            }
        }
    }

    public void validateRetry(RetryPolicy p) {
        if (p == null) {
            return;
        }
        if (p.getMaxAttempts() != null && p.getMaxAttempts() < 0) {
            throw new ScheduleValidationException("INVALID_RETRY", "max_attempts must be >= 0");
        }
        if (p.getRetryDelay() != null && p.getRetryDelay() < 0) {
            throw new ScheduleValidationException("INVALID_RETRY", "retry_delay must be >= 0");
        }
        if (p.getBackoffMultiplier() != null && p.getBackoffMultiplier() < 1.0) {
            throw new ScheduleValidationException("INVALID_RETRY", "backoff_multiplier must be >= 1");
        }
    }
}
