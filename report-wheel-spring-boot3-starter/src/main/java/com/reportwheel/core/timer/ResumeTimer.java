package com.reportwheel.core.timer;

import com.reportwheel.model.WheelTask;

/**
 * 进程内延迟唤醒; 只是加速, 到期时间已落库, 丢失后由扫描兜底
 */
public interface ResumeTimer {

    void schedule(WheelTask.Kind kind, String subjectId, long delayMillis, Runnable action);

    /**
     * 停止并返回未触发的任务数
     */
    int stop();
}
