package com.reportwheel.core.spi;

import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.enums.DeliveryMethodType;

import java.util.Map;

/**
 * 投递通道
 */
public interface DeliveryChannel {

    DeliveryMethodType type();

    /**
     * 创建/更新调度时校验通道配置
     */
    void validate(Map<String, Object> config) throws ChannelConfigException;

    /**
     * 展示用收件人
     */
    String recipient(Map<String, Object> config);

    /**
     * 投递一次; 失败抛出 DeliveryFailedException（标明可否重试）或任意异常（视为可重试）
     */
    DeliveryReceipt deliver(Map<String, Object> config, ReportArtifact artifact, DeliveryContext ctx) throws Exception;
}
