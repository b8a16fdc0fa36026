package com.reportwheel.exception.guard;

public class ChannelRateLimitedException extends RuntimeException {
    public ChannelRateLimitedException(String channel, Throwable cause) { super("channel " + channel + " rate limited", cause); }
}
