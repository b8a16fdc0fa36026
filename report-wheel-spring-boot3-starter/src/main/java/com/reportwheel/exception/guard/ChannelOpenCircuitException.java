package com.reportwheel.exception.guard;

/**
 * 通道熔断打开
 * 用于 FailureDecider 识别系统性故障
 */
public class ChannelOpenCircuitException extends RuntimeException {

    public ChannelOpenCircuitException(String channel, Throwable cause) {
        super("channel " + channel + " circuit open", cause);
    }
}
