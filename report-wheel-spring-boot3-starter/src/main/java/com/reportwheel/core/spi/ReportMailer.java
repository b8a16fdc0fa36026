package com.reportwheel.core.spi;

import com.reportwheel.model.MailMessage;

/**
 * 邮件发送 SPI, 由业务接入具体邮件服务
 */
public interface ReportMailer {

    /**
     * @return 邮件服务返回的 message id, 可为空
     */
    String send(MailMessage message) throws Exception;
}
