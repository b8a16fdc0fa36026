package com.reportwheel.core.spi.notify;

import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.enums.Severity;

/**
 * 告警通知器（永久失败、孤儿回收、持久化失败等）
 */
public interface Notifier {

    /**
     * 渠道名称, 用于路由日志
     */
    String name();

    default boolean supports(NotifyContext ctx) {
        return true;
    }

    /**
     * 同步方法 框架层负责异步调用
     */
    void notify(NotifyContext ctx, Severity severity);
}
