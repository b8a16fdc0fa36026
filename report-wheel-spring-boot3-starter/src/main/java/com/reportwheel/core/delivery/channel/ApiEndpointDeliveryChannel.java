package com.reportwheel.core.delivery.channel;

import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.enums.DeliveryMethodType;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * 把报表文件本体 POST/PUT 到业务接口
 */
public class ApiEndpointDeliveryChannel extends AbstractHttpDeliveryChannel {

    public ApiEndpointDeliveryChannel(HttpClient client, Duration timeout) {
        super(client, timeout);
    }

    @Override
    public DeliveryMethodType type() {
        return DeliveryMethodType.API_ENDPOINT;
    }

    @Override
    public void validate(Map<String, Object> config) throws ChannelConfigException {
        super.validate(config);
        method(config);
    }

    @Override
    protected HttpRequest build(HttpRequest.Builder builder, Map<String, Object> config,
                                ReportArtifact artifact, DeliveryContext ctx) {
        byte[] content = artifact.getContent() == null ? new byte[0] : artifact.getContent();
        String contentType = artifact.getContentType() == null ? "application/octet-stream" : artifact.getContentType();
        builder.header("Content-Type", contentType);
        if (artifact.getFileName() != null) {
            builder.header("Content-Disposition", "attachment; filename=\"" + artifact.getFileName() + "\"");
        }
        return builder.method(method(config), HttpRequest.BodyPublishers.ofByteArray(content)).build();
    }

    private static String method(Map<String, Object> config) {
        String m = ChannelConfigs.str(config, "method");
        if (m == null) {
            return "POST";
        }
        m = m.toUpperCase(Locale.ROOT);
        if (!m.equals("POST") && !m.equals("PUT")) {
            throw new ChannelConfigException("'method' must be POST or PUT, got " + m);
        }
        return m;
    }
}
