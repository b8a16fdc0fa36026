package com.reportwheel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * report:
 *   wheel:
 *     guard:
 *       circuit-breaker:
 *         failure-rate-threshold: 50
 *         wait-duration-in-open-state: 30s
 *       bulkhead:
 *         enabled: true
 *         max-concurrent-calls: 20
 *       per-channel:
 *         webhook:
 *           circuit-breaker: { failure-rate-threshold: 30 }
 */
@Data
@ConfigurationProperties(prefix = "report.wheel.guard")
public class DeliveryGuardProperties {

    /** 总开关 */
    private boolean enabled = true;

    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    /** 按通道覆盖, key 为 email / file_storage / api_endpoint / webhook */
    private Map<String, ChannelGuard> perChannel;

    @Data
    public static class ChannelGuard {
        private CbConfig circuitBreaker;
        private BhConfig bulkhead;
        private RlConfig rateLimiter;
    }

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(30);
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 20;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        private int limitForPeriod = 50;
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);
        private Duration timeoutDuration = Duration.ofMillis(100);
    }
}
