package com.reportwheel.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消信号, 由生成器在合适位置检查
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile String reason;

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    public String getReason() {
        return reason;
    }
}
