package com.reportwheel.model.ctx;

import lombok.Builder;
import lombok.Getter;

/**
 * 失败判定上下文
 */
@Getter
@Builder
public class FailureContext {

    public enum Subject { EXECUTION, DELIVERY }

    private final String nodeId;

    private final Subject subject;

    private final String scheduleId;

    private final String executionId;

    /** 仅 DELIVERY */
    private final String channel;

    /** 已用次数 */
    private final int used;

    /** 允许次数 */
    private final int allowed;
}
