package com.reportwheel.exception;

/**
 * 通道配置错误, 不可重试
 */
public class ChannelConfigException extends DeliveryFailedException {

    public ChannelConfigException(String message) {
        super("CHANNEL_CONFIG_INVALID", message, false, null);
    }
}
