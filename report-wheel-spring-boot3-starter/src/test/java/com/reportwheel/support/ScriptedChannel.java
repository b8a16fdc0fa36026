package com.reportwheel.support;

import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.enums.DeliveryMethodType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * 按脚本成功或抛异常的通道, 记录每次投递的上下文
 */
public class ScriptedChannel implements DeliveryChannel {

    private final DeliveryMethodType type;

    private final Deque<Exception> failures = new ArrayDeque<>();

    private final List<DeliveryContext> calls = new ArrayList<>();

    private final List<ReportArtifact> artifacts = new ArrayList<>();

    public ScriptedChannel(DeliveryMethodType type) {
        this.type = type;
    }

    /** 下一次投递抛出 e, 脚本用完后一律成功 */
    public synchronized ScriptedChannel thenFail(Exception e) {
        failures.add(e);
        return this;
    }

    public ScriptedChannel failTimes(int n, Exception e) {
        for (int i = 0; i < n; i++) {
            thenFail(e);
        }
        return this;
    }

    @Override
    public DeliveryMethodType type() {
        return type;
    }

    @Override
    public void validate(Map<String, Object> config) throws ChannelConfigException {
        if (config == null || !config.containsKey("target")) {
            throw new ChannelConfigException("'target' is required");
        }
    }

    @Override
    public String recipient(Map<String, Object> config) {
        return config == null ? null : String.valueOf(config.get("target"));
    }

    @Override
    public DeliveryReceipt deliver(Map<String, Object> config, ReportArtifact artifact, DeliveryContext ctx) throws Exception {
        Exception next;
        synchronized (this) {
            calls.add(ctx);
            artifacts.add(artifact);
            next = failures.poll();
        }
        if (next != null) {
            throw next;
        }
        return DeliveryReceipt.of("target", recipient(config));
    }

    public synchronized List<DeliveryContext> calls() {
        return new ArrayList<>(calls);
    }

    public synchronized List<ReportArtifact> artifacts() {
        return new ArrayList<>(artifacts);
    }
}
