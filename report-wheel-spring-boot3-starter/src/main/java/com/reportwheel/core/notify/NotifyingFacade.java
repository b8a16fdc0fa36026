package com.reportwheel.core.notify;

import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.enums.Severity;
import org.springframework.beans.factory.ObjectProvider;

import java.util.function.Supplier;

public class NotifyingFacade {

    private final Supplier<AsyncNotifyingService> delegate;

    public NotifyingFacade(ObjectProvider<AsyncNotifyingService> p) {
        // 未启用notify则为 null
        this.delegate = p::getIfAvailable;
    }

    public NotifyingFacade(Supplier<AsyncNotifyingService> delegate) {
        this.delegate = delegate;
    }

    /** 不发送任何通知 */
    public static NotifyingFacade disabled() {
        return new NotifyingFacade(() -> null);
    }

    public void fire(NotifyContext ctx, Severity sev) {
        AsyncNotifyingService s = delegate.get();
        if (s != null) s.fire(ctx, sev);
    }
}
