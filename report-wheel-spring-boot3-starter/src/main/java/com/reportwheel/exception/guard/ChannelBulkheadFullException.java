package com.reportwheel.exception.guard;

public class ChannelBulkheadFullException extends RuntimeException {
    public ChannelBulkheadFullException(String channel, Throwable cause) { super("channel " + channel + " bulkhead full", cause); }
}
