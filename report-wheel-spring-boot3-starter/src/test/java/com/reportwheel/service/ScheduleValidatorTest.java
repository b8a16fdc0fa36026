package com.reportwheel.service;

import com.reportwheel.core.cron.CronEvaluator;
import com.reportwheel.core.delivery.channel.ApiEndpointDeliveryChannel;
import com.reportwheel.core.delivery.channel.EmailDeliveryChannel;
import com.reportwheel.core.delivery.channel.FileStorageDeliveryChannel;
import com.reportwheel.core.delivery.channel.WebhookDeliveryChannel;
import com.reportwheel.core.serializer.JacksonPayloadSerializer;
import com.reportwheel.exception.ScheduleValidationException;
import com.reportwheel.model.DeliveryConfig;
import com.reportwheel.model.DeliveryMethod;
import com.reportwheel.model.RetryPolicy;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleValidatorTest {

    private final HttpClient http = HttpClient.newHttpClient();

    private final ScheduleValidator validator = new ScheduleValidator(new CronEvaluator(), List.of(
            new EmailDeliveryChannel(() -> null),
            new FileStorageDeliveryChannel(),
            new ApiEndpointDeliveryChannel(http, Duration.ofSeconds(5)),
            new WebhookDeliveryChannel(http, Duration.ofSeconds(5), new JacksonPayloadSerializer())),
            new MutableClock(Instant.parse("2024-05-01T08:00:00Z")));

    private static DeliveryMethod method(DeliveryMethodType type, Map<String, Object> config) {
        return DeliveryMethod.builder().type(type).config(new HashMap<>(config)).build();
    }

    private static DeliveryConfig config(DeliveryMethod... methods) {
        return DeliveryConfig.builder().methods(List.of(methods)).build();
    }

    private void assertInvalid(DeliveryConfig config, String code, String message) {
        assertThatThrownBy(() -> validator.validateDelivery(config))
                .isInstanceOf(ScheduleValidationException.class)
                .hasMessageContaining(message)
                .extracting("code").isEqualTo(code);
    }

    @Test
    void shouldAcceptEveryChannelWithCompleteConfig() {
        DeliveryConfig all = config(
                method(DeliveryMethodType.EMAIL, Map.of("recipients", List.of("ops@example.com"))),
                method(DeliveryMethodType.FILE_STORAGE, Map.of("path", "/srv/reports")),
                method(DeliveryMethodType.API_ENDPOINT, Map.of("url", "https://api.example.com/reports", "method", "PUT")),
                method(DeliveryMethodType.WEBHOOK, Map.of("url", "http://hooks.example.com/r",
                        "headers", Map.of("X-Token", "abc"))));

        assertThatCode(() -> validator.validateDelivery(all)).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectIncompleteChannelConfig() {
        assertInvalid(config(method(DeliveryMethodType.EMAIL, Map.of())),
                "INVALID_DELIVERY", "Invalid email config: 'recipients' must not be empty");
        assertInvalid(config(method(DeliveryMethodType.FILE_STORAGE, Map.of())),
                "INVALID_DELIVERY", "'path' is required");
        assertInvalid(config(method(DeliveryMethodType.WEBHOOK, Map.of("url", "hooks.example.com"))),
                "INVALID_DELIVERY", "absolute http(s) URL");
        assertInvalid(config(DeliveryMethod.builder().build()),
                "INVALID_DELIVERY", "type is required");
        assertInvalid(config(), "EMPTY_DELIVERY", "At least one delivery method");
    }

    @Test
    void shouldRejectDuplicateChannels() {
        assertInvalid(config(
                        method(DeliveryMethodType.FILE_STORAGE, Map.of("path", "/a")),
                        method(DeliveryMethodType.FILE_STORAGE, Map.of("path", "/b"))),
                "DUPLICATE_DELIVERY", "file_storage");
    }

    @Test
    void shouldValidateChannelRetryOverride() {
        DeliveryMethod webhook = method(DeliveryMethodType.WEBHOOK, Map.of("url", "https://hooks.example.com/r"));
        webhook.setRetry(RetryPolicy.builder().backoffMultiplier(0.5).build());

        assertInvalid(config(webhook), "INVALID_RETRY", "backoff_multiplier");
    }

    @Test
    void shouldValidateRetryBounds() {
        assertThatCode(() -> validator.validateRetry(RetryPolicy.builder().maxAttempts(0).retryDelay(0L).build()))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateRetry(RetryPolicy.builder().retryDelay(-1L).build()))
                .hasMessageContaining("retry_delay");
    }

    @Test
    void shouldValidateCronAndTimezone() {
        assertThatCode(() -> validator.validateCron("*/15 9-17 * * 1-5", "Europe/Berlin")).doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validateCron("0 6 * * *", "Nowhere/City"))
                .isInstanceOf(ScheduleValidationException.class)
                .extracting("code").isEqualTo("INVALID_TIMEZONE");
        assertThatThrownBy(() -> validator.validateCron(null, "UTC"))
                .isInstanceOf(ScheduleValidationException.class)
                .extracting("code").isEqualTo("INVALID_CRON");
    }
}
