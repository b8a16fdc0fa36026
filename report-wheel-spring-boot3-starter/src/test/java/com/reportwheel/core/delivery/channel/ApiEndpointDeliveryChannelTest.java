package com.reportwheel.core.delivery.channel;

import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.exception.DeliveryFailedException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.support.ScriptedGenerator;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiEndpointDeliveryChannelTest {

    private static final DeliveryContext CTX = DeliveryContext.builder()
            .executionId("e-1")
            .scheduleId("s-1")
            .channel(DeliveryMethodType.API_ENDPOINT)
            .attempt(2)
            .budget(3)
            .build();

    private MockWebServer server;

    private ApiEndpointDeliveryChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        channel = new ApiEndpointDeliveryChannel(client, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private Map<String, Object> config(String method) {
        Map<String, Object> config = new HashMap<>();
        config.put("url", server.url("/reports").toString());
        if (method != null) {
            config.put("method", method);
        }
        config.put("headers", Map.of("Authorization", "Bearer t0ken"));
        return config;
    }

    @Test
    void shouldUploadArtifactBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        DeliveryReceipt receipt = channel.deliver(config("put"), ScriptedGenerator.artifact("rx-1"), CTX);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/reports");
        assertThat(request.getHeader("Content-Type")).isEqualTo("text/csv");
        assertThat(request.getHeader("Content-Disposition")).isEqualTo("attachment; filename=\"sales.csv\"");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer t0ken");
        assertThat(request.getHeader("X-Report-Execution-Id")).isEqualTo("e-1");
        assertThat(request.getHeader("X-Report-Attempt")).isEqualTo("2");
        assertThat(request.getBody().readString(StandardCharsets.UTF_8)).startsWith("region,total");
        assertThat(receipt.getMetadata()).containsEntry("httpStatus", 201);
    }

    @Test
    void shouldTreatServerErrorsAsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));

        assertThatThrownBy(() -> channel.deliver(config(null), ScriptedGenerator.artifact("rx-1"), CTX))
                .isInstanceOfSatisfying(DeliveryFailedException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getMessage()).startsWith("HTTP 503").endsWith("maintenance");
                });
    }

    @Test
    void shouldTreatTooManyRequestsAsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> channel.deliver(config(null), ScriptedGenerator.artifact("rx-1"), CTX))
                .isInstanceOfSatisfying(DeliveryFailedException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    void shouldTreatClientErrorsAsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("bad payload"));

        assertThatThrownBy(() -> channel.deliver(config(null), ScriptedGenerator.artifact("rx-1"), CTX))
                .isInstanceOfSatisfying(DeliveryFailedException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void shouldValidateUrlAndMethod() {
        assertThatThrownBy(() -> channel.validate(Map.of("url", "ftp://files.example.com/x")))
                .isInstanceOf(ChannelConfigException.class)
                .hasMessageContaining("absolute http(s) URL");
        assertThatThrownBy(() -> channel.validate(Map.of("url", "https://api.example.com/x", "method", "GET")))
                .isInstanceOf(ChannelConfigException.class)
                .hasMessageContaining("POST or PUT");
        assertThatThrownBy(() -> channel.validate(Map.of("url", "https://api.example.com/x", "headers", "x")))
                .isInstanceOf(ChannelConfigException.class)
                .hasMessageContaining("'headers' must be an object");
    }
}
