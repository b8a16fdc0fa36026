package com.reportwheel.core.timer;

import com.reportwheel.model.WheelTask;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WheelResumeTimerTest {

    @Test
    void shouldRunTaskAfterDelay() throws Exception {
        WheelResumeTimer timer = new WheelResumeTimer(new HashedWheelTimer(10, TimeUnit.MILLISECONDS));
        CountDownLatch fired = new CountDownLatch(1);
        try {
            timer.schedule(WheelTask.Kind.EXECUTION_RETRY, "e-1", 20, fired::countDown);

            assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            timer.stop();
        }
    }

    @Test
    void shouldReportUnfiredTasksOnStop() {
        WheelResumeTimer timer = new WheelResumeTimer(new HashedWheelTimer(10, TimeUnit.MILLISECONDS));
        timer.schedule(WheelTask.Kind.DELIVERY_RETRY, "e-1:webhook", 60_000, () -> { });
        timer.schedule(WheelTask.Kind.SCANNER_WAKEUP, "s-1", 60_000, () -> { });

        assertThat(timer.stop()).isEqualTo(2);
    }
}
