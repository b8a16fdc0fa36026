package com.reportwheel.model.ctx;

import com.reportwheel.model.enums.NotifyEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotifyContext {

    private NotifyEventType type;

    private String nodeId;

    private String scheduleId;

    private String executionId;

    /** 投递事件时的通道 */
    private String channel;

    private Integer attempts;

    private Integer maxAttempts;

    // 分类码，如 TIMEOUT/ORPHANED/NON_RETRYABLE
    private String reasonCode;

    // 可被截断
    private String lastError;

    private Instant when;

    // 额外字段：op、nextRetryTime 等
    private Map<String, Object> attributes;
}
