package com.reportwheel.core.delivery.channel;

import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.exception.DeliveryFailedException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.ReportArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP 类通道: 5xx / 429 可重试, 其余 4xx 不可重试
 */
public abstract class AbstractHttpDeliveryChannel implements DeliveryChannel {

    Logger log = LoggerFactory.getLogger(getClass());

    protected static final int MAX_BODY_IN_ERROR = 500;

    protected final HttpClient client;

    protected final Duration timeout;

    protected AbstractHttpDeliveryChannel(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public void validate(Map<String, Object> config) throws ChannelConfigException {
        uri(config);
        ChannelConfigs.stringMap(config, "headers");
    }

    @Override
    public String recipient(Map<String, Object> config) {
        return ChannelConfigs.str(config, "url");
    }

    @Override
    public DeliveryReceipt deliver(Map<String, Object> config, ReportArtifact artifact, DeliveryContext ctx) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(uri(config))
                .timeout(timeout)
                .header("X-Report-Execution-Id", ctx.getExecutionId())
                .header("X-Report-Schedule-Id", ctx.getScheduleId())
                .header("X-Report-Attempt", String.valueOf(ctx.getAttempt()));
        ChannelConfigs.stringMap(config, "headers").forEach(b::header);
        HttpRequest request = build(b, config, artifact, ctx);

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            log.debug("[Delivery] {} {} -> {}", request.method(), request.uri(), status);
            return DeliveryReceipt.of("httpStatus", status).with("url", request.uri().toString());
        }
        String msg = "HTTP " + status + " from " + request.uri() + ": " + abbreviate(response.body());
        throw new DeliveryFailedException(msg, status == 429 || status >= 500);
    }

    /**
     * 子类设置方法与请求体
     */
    protected abstract HttpRequest build(HttpRequest.Builder builder, Map<String, Object> config,
                                         ReportArtifact artifact, DeliveryContext ctx) throws Exception;

    protected URI uri(Map<String, Object> config) {
        String url = ChannelConfigs.required(config, "url");
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ChannelConfigException("'url' is not a valid URI: " + url);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getHost() == null) {
            throw new ChannelConfigException("'url' must be an absolute http(s) URL: " + url);
        }
        return uri;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_IN_ERROR ? body.substring(0, MAX_BODY_IN_ERROR) + "..." : body;
    }
}
