package com.reportwheel.core.engine;

import com.reportwheel.model.CancellationSignal;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本进程内运行中执行的取消信号
 */
public class CancellationRegistry {

    private final Map<String, CancellationSignal> signals = new ConcurrentHashMap<>();

    public CancellationSignal register(String executionId) {
        return signals.computeIfAbsent(executionId, k -> new CancellationSignal());
    }

    /**
     * @return 本进程是否持有该执行
     */
    public boolean signal(String executionId, String reason) {
        CancellationSignal s = signals.get(executionId);
        if (s == null) {
            return false;
        }
        s.cancel(reason);
        return true;
    }

    public int signalAll(Collection<String> executionIds, String reason) {
        int n = 0;
        for (String id : executionIds) {
            if (signal(id, reason)) {
                n++;
            }
        }
        return n;
    }

    public void remove(String executionId) {
        signals.remove(executionId);
    }

    public int size() {
        return signals.size();
    }
}
