package com.reportwheel.core.delivery;

import com.reportwheel.config.DeliveryGuardProperties;
import com.reportwheel.exception.guard.ChannelBulkheadFullException;
import com.reportwheel.exception.guard.ChannelOpenCircuitException;
import com.reportwheel.exception.guard.ChannelRateLimitedException;
import com.reportwheel.model.enums.DeliveryMethodType;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * 按通道类型对投递调用增加 RL/BH/CB 装饰
 */
public class GuardedChannelExecutor {

    private final DeliveryGuardProperties props;

    private final ConcurrentHashMap<DeliveryMethodType, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DeliveryMethodType, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DeliveryMethodType, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedChannelExecutor(DeliveryGuardProperties props) {
        this.props = props;
    }

    /**
     * 统一入口, 组合顺序 RateLimiter → Bulkhead → CircuitBreaker
     */
    public <T> T execute(DeliveryMethodType type, Callable<T> call) throws Exception {
        if (!props.isEnabled()) {
            return call.call();
        }
        Callable<T> decorated = call;

        // 最外层限流
        DeliveryGuardProperties.RlConfig rl = pick(type, DeliveryGuardProperties.ChannelGuard::getRateLimiter, props.getRateLimiter());
        if (rl != null && rl.isEnabled()) {
            decorated = RateLimiter.decorateCallable(rlCache.computeIfAbsent(type, k -> buildRl(k, rl)), decorated);
        }

        // 限制下游并发
        DeliveryGuardProperties.BhConfig bh = pick(type, DeliveryGuardProperties.ChannelGuard::getBulkhead, props.getBulkhead());
        if (bh != null && bh.isEnabled()) {
            decorated = Bulkhead.decorateCallable(bhCache.computeIfAbsent(type, k -> buildBh(k, bh)), decorated);
        }

        // 熔断
        DeliveryGuardProperties.CbConfig cb = pick(type, DeliveryGuardProperties.ChannelGuard::getCircuitBreaker, props.getCircuitBreaker());
        if (cb != null && cb.isEnabled()) {
            decorated = CircuitBreaker.decorateCallable(cbCache.computeIfAbsent(type, k -> buildCb(k, cb)), decorated);
        }

        try {
            return decorated.call();
        } catch (CallNotPermittedException open) {
            throw new ChannelOpenCircuitException(type.code(), open);
        } catch (BulkheadFullException full) {
            throw new ChannelBulkheadFullException(type.code(), full);
        } catch (RequestNotPermitted rnp) {
            throw new ChannelRateLimitedException(type.code(), rnp);
        }
    }

    /**
     * 通道覆盖优先, 否则取默认
     */
    private <C> C pick(DeliveryMethodType type, Function<DeliveryGuardProperties.ChannelGuard, C> getter, C defaultCfg) {
        if (props.getPerChannel() == null) {
            return defaultCfg;
        }
        DeliveryGuardProperties.ChannelGuard g = props.getPerChannel().get(type.code());
        C c = g == null ? null : getter.apply(g);
        return c == null ? defaultCfg : c;
    }

    private RateLimiter buildRl(DeliveryMethodType type, DeliveryGuardProperties.RlConfig r) {
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + type.code(), cfg);
    }

    private Bulkhead buildBh(DeliveryMethodType type, DeliveryGuardProperties.BhConfig b) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + type.code(), cfg);
    }

    private CircuitBreaker buildCb(DeliveryMethodType type, DeliveryGuardProperties.CbConfig c) {
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + type.code(), cfg);
    }
}
