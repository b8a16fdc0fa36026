package com.reportwheel.core.delivery.channel;

import com.reportwheel.core.spi.ReportMailer;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.MailMessage;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.support.ScriptedGenerator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailDeliveryChannelTest {

    private static final DeliveryContext CTX = DeliveryContext.builder()
            .executionId("e-1")
            .scheduleId("s-1")
            .scheduleName("Daily sales")
            .channel(DeliveryMethodType.EMAIL)
            .attempt(1)
            .budget(3)
            .build();

    @Test
    void shouldSendArtifactAsAttachment() throws Exception {
        ReportMailer mailer = mock(ReportMailer.class);
        when(mailer.send(any())).thenReturn("msg-42");
        EmailDeliveryChannel channel = new EmailDeliveryChannel(() -> mailer);

        DeliveryReceipt receipt = channel.deliver(
                Map.of("recipients", List.of("a@example.com", "b@example.com"), "cc", "boss@example.com"),
                ScriptedGenerator.artifact("rx-1"), CTX);

        ArgumentCaptor<MailMessage> sent = ArgumentCaptor.forClass(MailMessage.class);
        verify(mailer).send(sent.capture());
        MailMessage m = sent.getValue();
        assertThat(m.getTo()).containsExactly("a@example.com", "b@example.com");
        assertThat(m.getCc()).containsExactly("boss@example.com");
        assertThat(m.getSubject()).isEqualTo("Report: Daily sales");
        assertThat(m.getAttachmentName()).isEqualTo("sales.csv");
        assertThat(m.getAttachmentContentType()).isEqualTo("text/csv");
        assertThat(receipt.getMetadata()).containsEntry("messageId", "msg-42").containsEntry("recipients", 2);
    }

    @Test
    void shouldUseConfiguredSubject() throws Exception {
        ReportMailer mailer = mock(ReportMailer.class);
        EmailDeliveryChannel channel = new EmailDeliveryChannel(() -> mailer);

        channel.deliver(Map.of("recipients", "a@example.com", "subject", "Weekly numbers"),
                ScriptedGenerator.artifact("rx-1"), CTX);

        ArgumentCaptor<MailMessage> sent = ArgumentCaptor.forClass(MailMessage.class);
        verify(mailer).send(sent.capture());
        assertThat(sent.getValue().getSubject()).isEqualTo("Weekly numbers");
    }

    @Test
    void shouldRejectMissingOrMalformedRecipients() {
        EmailDeliveryChannel channel = new EmailDeliveryChannel(() -> null);

        assertThatThrownBy(() -> channel.validate(Map.of()))
                .isInstanceOf(ChannelConfigException.class)
                .hasMessageContaining("'recipients' must not be empty");
        assertThatThrownBy(() -> channel.validate(Map.of("recipients", "not-an-address")))
                .isInstanceOf(ChannelConfigException.class)
                .hasMessageContaining("not-an-address");
        assertThat(channel.recipient(Map.of("recipients", "a@example.com, b@example.com")))
                .isEqualTo("a@example.com,b@example.com");
    }

    @Test
    void shouldFailWithoutMailer() {
        EmailDeliveryChannel channel = new EmailDeliveryChannel(() -> null);

        assertThatThrownBy(() -> channel.deliver(Map.of("recipients", "a@example.com"),
                ScriptedGenerator.artifact("rx-1"), CTX))
                .isInstanceOf(ChannelConfigException.class)
                .hasMessageContaining("No ReportMailer");
    }
}
