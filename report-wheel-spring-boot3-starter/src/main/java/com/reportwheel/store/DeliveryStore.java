package com.reportwheel.store;

import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.entity.DeliveryLogEntity;
import com.reportwheel.model.enums.DeliveryStatus;
import com.reportwheel.model.query.DeliveryLogQuery;
import com.reportwheel.model.view.PageResult;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 通道投递状态 + 只追加的投递日志
 */
public interface DeliveryStore {

    /**
     * 已存在的 (execution_id, channel) 忽略
     */
    int insertAttemptsIfAbsent(List<DeliveryAttemptEntity> attempts);

    Optional<DeliveryAttemptEntity> findAttempt(String executionId, String channel);

    List<DeliveryAttemptEntity> findAttempts(String executionId);

    List<DeliveryAttemptEntity> findAttempts(Collection<String> executionIds);

    /**
     * 开始一次尝试: attempt_count + 1, next_attempt_time 置为租约到期
     */
    boolean beginAttempt(Long id, int version, Instant now, Instant leaseUntil);

    boolean markDelivered(Long id, int version, Instant deliveredAt);

    /** 仍为 PENDING, 等待下次尝试 */
    boolean markRetryPending(Long id, int version, Instant nextAttemptTime, String error);

    boolean markFailed(Long id, int version, String error);

    /**
     * FAILED → PENDING, 预算调整为 budget
     */
    boolean reopen(Long id, int version, int budget, Instant now);

    /** PENDING 且 next_attempt_time <= now */
    List<DeliveryAttemptEntity> findDue(Instant now, int limit);

    void appendLog(DeliveryLogEntity log);

    Optional<DeliveryLogEntity> findLog(String logId);

    List<DeliveryLogEntity> findLogs(Collection<String> executionIds);

    PageResult<DeliveryLogEntity> pageLogs(DeliveryLogQuery query);

    /** status 为空时统计全部 */
    long countAttemptsCreatedSince(Instant since, DeliveryStatus status);

    int deleteByExecutions(Collection<String> executionIds);
}
