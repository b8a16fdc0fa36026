package com.reportwheel.core.notify;

import com.reportwheel.core.retry.RetryDecision;
import com.reportwheel.model.ctx.NotifyContext;
import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.NotifyEventType;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    public static NotifyContext ctxForExecutionFailed(String nodeId, ScheduleExecutionEntity e,
                                                      RetryDecision decision, Throwable cause, Clock clock) {
        boolean nonRetryable = decision.getVerdict() == RetryDecision.Verdict.NON_RETRYABLE;
        Map<String, Object> attrs = baseAttrs(e);
        attrs.put("category", decision.getCause() == null ? null : decision.getCause().getCategory());
        return NotifyContext.builder()
                .type(nonRetryable ? NotifyEventType.NON_RETRYABLE_FAILED : NotifyEventType.EXECUTION_FAILED)
                .nodeId(nodeId)
                .scheduleId(e.getScheduleId())
                .executionId(e.getExecutionId())
                .attempts(e.getRetryCount())
                .maxAttempts(e.getMaxAttempts())
                .reasonCode(decision.reasonCode())
                .lastError(truncate(toError(cause)))
                .when(clock.instant())
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForDeliveryFailed(String nodeId, DeliveryAttemptEntity a,
                                                     RetryDecision decision, Throwable cause, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("recipient", a.getRecipient());
        return NotifyContext.builder()
                .type(NotifyEventType.DELIVERY_FAILED)
                .nodeId(nodeId)
                .scheduleId(a.getScheduleId())
                .executionId(a.getExecutionId())
                .channel(a.getChannel())
                .attempts(a.getAttemptCount())
                .maxAttempts(a.getAttemptBudget())
                .reasonCode(decision.reasonCode())
                .lastError(truncate(toError(cause)))
                .when(clock.instant())
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForOrphan(String nodeId, ScheduleExecutionEntity e, Clock clock) {
        Map<String, Object> attrs = baseAttrs(e);
        attrs.put("startTime", e.getStartTime() == null ? null : e.getStartTime().toString());
        return NotifyContext.builder()
                .type(NotifyEventType.ORPHAN_RECOVERED)
                .nodeId(nodeId)
                .scheduleId(e.getScheduleId())
                .executionId(e.getExecutionId())
                .attempts(e.getRetryCount())
                .maxAttempts(e.getMaxAttempts())
                .reasonCode("ORPHANED")
                .when(clock.instant())
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForOverlap(String nodeId, ReportScheduleEntity s, String activeExecutionId, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("activeExecutionId", activeExecutionId);
        attrs.put("nextExecution", s.getNextExecution() == null ? null : s.getNextExecution().toString());
        return NotifyContext.builder()
                .type(NotifyEventType.OVERLAP_SKIPPED)
                .nodeId(nodeId)
                .scheduleId(s.getScheduleId())
                .executionId(activeExecutionId)
                .reasonCode("OVERLAP")
                .when(clock.instant())
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForPersistFail(String nodeId, String scheduleId, String executionId,
                                                  String op, Exception e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("op", op);
        return NotifyContext.builder()
                .type(NotifyEventType.PERSIST_FAILED)
                .nodeId(nodeId)
                .scheduleId(scheduleId)
                .executionId(executionId)
                .reasonCode("PERSIST_FAILED")
                .lastError(truncate(toError(e)))
                .when(clock.instant())
                .attributes(attrs)
                .build();
    }

    public static NotifyContext ctxForEngineError(String nodeId, String component, Throwable e, Clock clock) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("component", component);
        return NotifyContext.builder()
                .type(NotifyEventType.ENGINE_ERROR)
                .nodeId(nodeId)
                .reasonCode("ENGINE_ERROR")
                .lastError(truncate(toError(e)))
                .when(clock.instant())
                .attributes(attrs)
                .build();
    }

    /* ========== 私有工具 ========== */

    private static Map<String, Object> baseAttrs(ScheduleExecutionEntity e) {
        Map<String, Object> m = new HashMap<>();
        m.put("trigger", e.getTriggerType());
        m.put("version", e.getVersion());
        if (e.getScheduledTime() != null) {
            m.put("scheduledTime", e.getScheduledTime().toString());
        }
        return m;
    }

    private static String toError(Throwable e) {
        if (e == null) return null;
        StringBuilder sb = new StringBuilder(e.getClass().getName())
                .append(": ")
                .append(e.getMessage() == null ? "" : e.getMessage());
        // 只取前10行堆栈
        StackTraceElement[] stack = e.getStackTrace();
        int n = Math.min(stack.length, 10);
        for (int i = 0; i < n; i++) sb.append("\n  at ").append(stack[i]);
        return sb.toString();
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
