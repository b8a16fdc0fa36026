package com.reportwheel.core.notify;

import com.reportwheel.core.metric.ReportWheelMetrics;
import com.reportwheel.core.spi.notify.Notifier;
import com.reportwheel.core.spi.notify.NotifierFilter;
import com.reportwheel.core.spi.notify.NotifierRouter;
import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * 异步派发
 * 路由 → 限流 → 异步执行, 单个 notifier 失败重试 3 次
 */
public class AsyncNotifyingService {

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final ReportWheelMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter, ReportWheelMetrics metrics) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        exec.execute(() -> {
            List<Notifier> notifiers = router.route(ctx, sev);
            for (Notifier n : notifiers) {
                if (!n.supports(ctx)) {
                    continue;
                }
                try {
                    deliver(n, ctx, sev);
                    metrics.incNotifySent();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    metrics.incNotifyFailed();
                    log.warn("[Notify] channel={} event={} interrupted", n.name(), ctx.getType());
                    return;
                } catch (Exception e) {
                    metrics.incNotifyFailed();
                    log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
                }
            }
        });
    }

    private void deliver(Notifier n, NotifyContext ctx, Severity sev) throws InterruptedException {
        int attempt = 0;
        long backoff = 200;
        while (true) {
            try {
                n.notify(ctx, sev);
                return;
            } catch (RuntimeException e) {
                if (++attempt >= 3) {
                    throw e;
                }
                Thread.sleep(backoff);
                backoff = Math.min(backoff * 2, 4000);
            }
        }
    }
}
