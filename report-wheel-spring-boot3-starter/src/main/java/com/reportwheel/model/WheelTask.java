package com.reportwheel.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 挂在时间轮上的恢复任务
 * 让 timer.stop() 返回的 Timeout 能识别是哪个执行/通道
 */
public class WheelTask implements TimerTask {

    public enum Kind { EXECUTION_RETRY, DELIVERY_RETRY, SCANNER_WAKEUP }

    private final Kind kind;

    /** executionId 或 executionId:channel */
    private final String subjectId;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    public WheelTask(Kind kind, String subjectId, Runnable actual) {
        this.kind = kind;
        this.subjectId = subjectId;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) {
        actual.run();
    }

    public Kind getKind() {
        return kind;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
