package com.reportwheel.core.delivery.channel;

import com.reportwheel.core.spi.PayloadSerializer;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.enums.DeliveryMethodType;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 推送一条 JSON 通知（执行摘要 + 产物元数据）, 不含文件本体
 */
public class WebhookDeliveryChannel extends AbstractHttpDeliveryChannel {

    public static final String EVENT = "report.completed";

    private final PayloadSerializer serializer;

    public WebhookDeliveryChannel(HttpClient client, Duration timeout, PayloadSerializer serializer) {
        super(client, timeout);
        this.serializer = serializer;
    }

    @Override
    public DeliveryMethodType type() {
        return DeliveryMethodType.WEBHOOK;
    }

    @Override
    protected HttpRequest build(HttpRequest.Builder builder, Map<String, Object> config,
                                ReportArtifact artifact, DeliveryContext ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", EVENT);
        body.put("executionId", ctx.getExecutionId());
        body.put("scheduleId", ctx.getScheduleId());
        body.put("scheduleName", ctx.getScheduleName());
        body.put("reportId", ctx.getReportId());
        body.put("scheduledTime", ctx.getScheduledTime());
        body.put("completedAt", ctx.getCompletedAt());
        body.put("attempt", ctx.getAttempt());
        body.put("artifact", artifact.descriptor());
        return builder.header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(serializer.serialize(body)))
                .build();
    }
}
