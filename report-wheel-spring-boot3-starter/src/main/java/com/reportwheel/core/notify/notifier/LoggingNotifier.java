package com.reportwheel.core.notify.notifier;

import com.reportwheel.core.spi.notify.Notifier;
import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] schedule={}, execution={}, channel={}, reason={}, err={}, attrs={}",
                    ctx.getType(), ctx.getScheduleId(), ctx.getExecutionId(), ctx.getChannel(), ctx.getReasonCode(),
                    truncate(ctx.getLastError()), ctx.getAttributes());
            case WARNING -> log.warn("[Notify-{}] schedule={}, execution={}, channel={}, reason={}, attrs={}",
                    ctx.getType(), ctx.getScheduleId(), ctx.getExecutionId(), ctx.getChannel(), ctx.getReasonCode(),
                    ctx.getAttributes());
            default -> log.info("[Notify-{}] schedule={}, execution={}", ctx.getType(), ctx.getScheduleId(), ctx.getExecutionId());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
