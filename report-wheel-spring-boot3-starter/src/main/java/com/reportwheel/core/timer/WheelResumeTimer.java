package com.reportwheel.core.timer;

import com.reportwheel.model.WheelTask;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

public class WheelResumeTimer implements ResumeTimer {

    Logger log = LoggerFactory.getLogger(WheelResumeTimer.class);

    private final HashedWheelTimer timer;

    public WheelResumeTimer(HashedWheelTimer timer) {
        this.timer = timer;
    }

    @Override
    public void schedule(WheelTask.Kind kind, String subjectId, long delayMillis, Runnable action) {
        timer.newTimeout(new WheelTask(kind, subjectId, action), Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
    }

    /**
     * 停止时间轮; 未触发的恢复任务不需要回写, next_retry_time / next_attempt_time 已在库中
     */
    @Override
    public int stop() {
        Set<Timeout> unProcessed = timer.stop();
        if (unProcessed == null || unProcessed.isEmpty()) {
            log.info("[Report-Wheel] timer stopped with no unprocessed timeouts.");
            return 0;
        }
        Map<WheelTask.Kind, Long> byKind = unProcessed.stream()
                .filter(t -> t != null && t.task() instanceof WheelTask)
                .collect(Collectors.groupingBy(t -> ((WheelTask) t.task()).getKind(), Collectors.counting()));
        log.info("[Report-Wheel] timer stopped, unprocessed={} byKind={}, resumed by scanner after restart",
                unProcessed.size(), byKind);
        return unProcessed.size();
    }
}
