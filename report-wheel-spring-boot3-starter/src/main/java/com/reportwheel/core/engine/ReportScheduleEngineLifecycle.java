package com.reportwheel.core.engine;

import com.reportwheel.config.ReportNotifierProperties;
import com.reportwheel.config.ReportWheelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class ReportScheduleEngineLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(ReportScheduleEngineLifecycle.class);

    private final ReportScheduleEngine engine;

    private final ReportWheelProperties props;

    private final ReportNotifierProperties notifyProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReportScheduleEngineLifecycle(ReportScheduleEngine engine, ReportWheelProperties props,
                                         ReportNotifierProperties notifyProps) {
        this.engine = engine;
        this.props = props;
        this.notifyProps = notifyProps;
    }

    @Override
    public void start() {
        running.compareAndSet(false, props.getScan().isEnabled());
        if (!running.get()) {
            log.info("[Report-Wheel] start skipped, scan disabled, nodeId={}", engine.getNodeId());
            return;
        }
        try {
            log.info("┌──────────────────────────────────────────────");
            log.info("│ ReportScheduleEngine starting...");
            log.info("├──────────────────────────────────────────────");
            log.info("│ nodeId              : {}", engine.getNodeId());
            log.info("│ scan.period         : {} ms", props.getScan().getPeriod().toMillis());
            log.info("│ scan.batch          : {}", props.getScan().getBatch());
            log.info("│ wheel.tick          : {} ms", props.getWheel().getTickDuration().toMillis());
            log.info("│ wheel.size          : {}", props.getWheel().getTicksPerWheel());
            log.info("│ exec.core/max       : {}/{}", props.getExecutor().getCorePoolSize(), props.getExecutor().getMaxPoolSize());
            log.info("│ delivery.core/max   : {}/{}", props.getDelivery().getCorePoolSize(), props.getDelivery().getMaxPoolSize());
            log.info("│ execution.timeout   : {} ms", props.getExecution().getTimeout().toMillis());
            log.info("│ execution.stale     : {} ms", props.getExecution().getStaleThreshold().toMillis());
            log.info("│ retry.default       : max={} delay={}ms x{} ({})", props.getRetry().getMaxAttempts(),
                    props.getRetry().getRetryDelay().toMillis(), props.getRetry().getBackoffMultiplier(),
                    props.getRetry().getStrategy());
            log.info("│ notifier.enabled    : {}", notifyProps.isEnabled());
            log.info("└──────────────────────────────────────────────");
        } catch (Throwable t) {
            log.warn("[Report-Wheel] failed to render startup banner: {}", t.toString());
        }
        engine.start();
        log.info("[Report-Wheel] started: first scan in {} ms (nodeId={})",
                props.getScan().getInitialDelay().toMillis(), engine.getNodeId());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Report-Wheel] stop skipped: not running (nodeId={})", engine.getNodeId());
            return;
        }
        log.info("[Report-Wheel] stopping... (nodeId={})", engine.getNodeId());
        try {
            engine.stop();
        } finally {
            log.info("[Report-Wheel] stopped (nodeId={})", engine.getNodeId());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() { return true; }
}
