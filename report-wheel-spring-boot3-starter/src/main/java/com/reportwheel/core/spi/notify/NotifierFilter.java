package com.reportwheel.core.spi.notify;

import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.enums.Severity;

/**
 * 过滤器：限流、去抖
 */
public interface NotifierFilter {

    /**
     * 返回 true 表示放行
     */
    boolean allow(NotifyContext ctx, Severity severity);
}
