package com.reportwheel.core.notify.route;

import com.reportwheel.core.spi.notify.Notifier;
import com.reportwheel.core.spi.notify.NotifierRouter;
import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.enums.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * 默认路由: 全部事件走日志, 外加业务注册的 notifier
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    public SimpleRouter(Notifier log, List<Notifier> extra) {
        List<Notifier> all = new ArrayList<>();
        all.add(log);
        if (extra != null) {
            extra.stream().filter(n -> n != log).forEach(all::add);
        }
        this.notifiers = List.copyOf(all);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        return notifiers;
    }
}
