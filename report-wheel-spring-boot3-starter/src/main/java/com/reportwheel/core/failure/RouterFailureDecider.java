package com.reportwheel.core.failure;

import com.reportwheel.core.spi.failure.FailureCaseHandler;
import com.reportwheel.core.spi.failure.FailureDecider;
import com.reportwheel.model.ctx.FailureContext;

import java.util.Comparator;
import java.util.List;

public class RouterFailureDecider implements FailureDecider {

    private final List<FailureCaseHandler<?>> handlers;

    /** 未匹配时的默认决策: 视为瞬时失败 */
    private final Decision defaultDecision;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Decision.of(Outcome.RETRY, Category.UNKNOWN).withCode("UNHANDLED"));
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, Decision defaultDecision) {
        this.handlers = handlers == null ? List.of() : handlers.stream().distinct().toList();
        this.defaultDecision = defaultDecision;
    }

    /**
     * 先本体再逐级 cause, 同层选择离异常类最近的处理器
     * 处理 Throwable 的兜底处理器只在整条 cause 链都未命中时使用
     */
    @Override
    public Decision decide(Throwable t, FailureContext ctx) {
        for (Throwable e = t; e != null; e = e.getCause()) {
            FailureCaseHandler<?> matched = findBestHandler(e, false);
            if (matched != null) {
                return call(matched, e, ctx);
            }
        }
        FailureCaseHandler<?> fallback = t == null ? null : findBestHandler(t, true);
        return fallback == null ? defaultDecision : call(fallback, t, ctx);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Decision call(FailureCaseHandler h, Throwable e, FailureContext ctx) {
        return h.execute(e, ctx);
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e, boolean catchAll) {
        return handlers.stream()
                .filter(h -> Throwable.class.equals(h.exceptionType()) == catchAll)
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
