package com.reportwheel.core.delivery.channel;

import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.core.spi.ReportMailer;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.MailMessage;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.enums.DeliveryMethodType;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 邮件通道, 实际发送交给业务提供的 ReportMailer
 */
public class EmailDeliveryChannel implements DeliveryChannel {

    private final Supplier<ReportMailer> mailer;

    public EmailDeliveryChannel(ObjectProvider<ReportMailer> mailer) {
        this.mailer = mailer::getIfAvailable;
    }

    public EmailDeliveryChannel(Supplier<ReportMailer> mailer) {
        this.mailer = mailer;
    }

    @Override
    public DeliveryMethodType type() {
        return DeliveryMethodType.EMAIL;
    }

    @Override
    public void validate(Map<String, Object> config) throws ChannelConfigException {
        recipients(config);
        ChannelConfigs.list(config, "cc").forEach(EmailDeliveryChannel::checkAddress);
    }

    @Override
    public String recipient(Map<String, Object> config) {
        return String.join(",", ChannelConfigs.list(config, "recipients"));
    }

    @Override
    public DeliveryReceipt deliver(Map<String, Object> config, ReportArtifact artifact, DeliveryContext ctx) throws Exception {
        ReportMailer m = mailer.get();
        if (m == null) {
            throw new ChannelConfigException("No ReportMailer bean registered, email delivery is unavailable");
        }
        List<String> to = recipients(config);
        String name = ctx.getScheduleName() == null ? ctx.getScheduleId() : ctx.getScheduleName();
        String subject = ChannelConfigs.str(config, "subject");
        String body = ChannelConfigs.str(config, "body");
        MailMessage message = MailMessage.builder()
                .to(to)
                .cc(ChannelConfigs.list(config, "cc"))
                .subject(subject == null ? "Report: " + name : subject)
                .body(body == null ? "Scheduled report " + name + " is attached." : body)
                .attachmentName(artifact.getFileName())
                .attachmentContentType(artifact.getContentType())
                .attachment(artifact.getContent())
                .build();
        String messageId = m.send(message);
        return DeliveryReceipt.of("messageId", messageId).with("recipients", to.size());
    }

    private static List<String> recipients(Map<String, Object> config) {
        List<String> to = ChannelConfigs.list(config, "recipients");
        if (to.isEmpty()) {
            throw new ChannelConfigException("'recipients' must not be empty");
        }
        to.forEach(EmailDeliveryChannel::checkAddress);
        return to;
    }

    private static void checkAddress(String address) {
        int at = address.indexOf('@');
        if (at <= 0 || at == address.length() - 1) {
            throw new ChannelConfigException("invalid email address: " + address);
        }
    }
}
