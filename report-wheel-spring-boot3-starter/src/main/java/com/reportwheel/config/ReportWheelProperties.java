package com.reportwheel.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 报表调度引擎配置（绑定前缀：report.wheel）
 *
 * YAML 示例：
 * report:
 *   wheel:
 *     wheel:
 *       tick-duration: 100ms
 *       ticks-per-wheel: 512
 *     scan:
 *       enabled: true
 *       initial-delay: 1s
 *       period: 30s
 *       batch: 100
 *     executor:
 *       core-pool-size: 4
 *       max-pool-size: 4
 *       queue-capacity: 1000
 *     delivery:
 *       core-pool-size: 8
 *       lease: 5m
 *     retry:
 *       max-attempts: 3
 *       retry-delay: 5000ms
 *       backoff-multiplier: 2
 *       strategy: exponential
 *       jitter-ratio: 0
 *     execution:
 *       timeout: 10m
 *       stale-threshold: 30m
 *     shutdown:
 *       await: 30s
 */
@Validated
@ConfigurationProperties(prefix = "report.wheel")
public class ReportWheelProperties {

    private Tx tx = new Tx();

    private Wheel wheel = new Wheel();

    private Scan scan = new Scan();

    private Exec executor = new Exec();

    private Delivery delivery = new Delivery();

    private Retry retry = new Retry();

    private Execution execution = new Execution();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Tx {
        private Propagation propagation = Propagation.REQUIRED;

        private Isolation isolation = Isolation.DEFAULT;

        /** 超时（秒，<=0 表示不设置） */
        private int timeoutSeconds = 0;

        public Propagation getPropagation() { return propagation; }
        public void setPropagation(Propagation propagation) { this.propagation = propagation; }
        public Isolation getIsolation() { return isolation; }
        public void setIsolation(Isolation isolation) { this.isolation = isolation; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Wheel {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量 */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Scan {
        /** 是否启动扫描 */
        private boolean enabled = false;

        /** 首次扫描延迟 */
        private Duration initialDelay = Duration.ofSeconds(1);

        /** 扫描周期 */
        private Duration period = Duration.ofSeconds(30);

        /** 每轮最多处理的到期调度数 */
        @Min(1)
        private int batch = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getPeriod() { return period; }
        public void setPeriod(Duration period) { this.period = period; }
        public int getBatch() { return batch; }
        public void setBatch(int batch) { this.batch = batch; }
    }

    /**
     * 执行线程池, 大小即报表并行生成上限
     */
    public static class Exec {
        private int corePoolSize = 4;

        private int maxPoolSize = 4;

        private int queueCapacity = 1000;

        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Delivery {
        private int corePoolSize = 8;

        private int maxPoolSize = 16;

        private int queueCapacity = 2000;

        private Duration keepAlive = Duration.ofSeconds(60);

        /** 进行中尝试的租约, 超时后由扫描兜底重新尝试; 应大于通道调用超时 */
        private Duration lease = Duration.ofMinutes(5);

        /** HTTP 类通道连接/请求超时 */
        private Duration httpTimeout = Duration.ofSeconds(30);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public Duration getLease() { return lease; }
        public void setLease(Duration lease) { this.lease = lease; }
        public Duration getHttpTimeout() { return httpTimeout; }
        public void setHttpTimeout(Duration httpTimeout) { this.httpTimeout = httpTimeout; }
    }

    /**
     * 调度未配置 retry_config 时的默认值
     */
    public static class Retry {
        @Min(0)
        private int maxAttempts = 3;

        private Duration retryDelay = Duration.ofMillis(5000);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 抖动比例（0~1），0 表示不抖动 */
        private double jitterRatio = 0;

        /** 单次延迟上限 */
        private Duration maxDelay = Duration.ofHours(1);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }

    public static class Execution {
        /** 单次生成的墙钟超时 */
        private Duration timeout = Duration.ofMinutes(10);

        /** running 超过该时长且无进程持有则视为孤儿 */
        private Duration staleThreshold = Duration.ofMinutes(30);

        /** pending 超过该时长未被领取则由扫描兜底派发 */
        private Duration pendingGrace = Duration.ofMinutes(1);

        /** 调度详情展示的最近执行数 */
        private int recentLimit = 10;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getStaleThreshold() { return staleThreshold; }
        public void setStaleThreshold(Duration staleThreshold) { this.staleThreshold = staleThreshold; }
        public Duration getPendingGrace() { return pendingGrace; }
        public void setPendingGrace(Duration pendingGrace) { this.pendingGrace = pendingGrace; }
        public int getRecentLimit() { return recentLimit; }
        public void setRecentLimit(int recentLimit) { this.recentLimit = recentLimit; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    /** 线程池拒绝策略枚举 */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public static RejectedHandlerPolicy from(String v) {
            return RejectedHandlerPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT));
        }

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public Tx getTx() { return tx; }
    public void setTx(Tx tx) { this.tx = tx; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Delivery getDelivery() { return delivery; }
    public void setDelivery(Delivery delivery) { this.delivery = delivery; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }
}
