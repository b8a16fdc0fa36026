package com.reportwheel.store;

import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.model.query.ExecutionQuery;
import com.reportwheel.model.view.PageResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 执行表; mark* 均为带 version 的状态迁移, 返回 false 表示已被并发修改
 */
public interface ExecutionStore {

    void insert(ScheduleExecutionEntity execution);

    Optional<ScheduleExecutionEntity> find(String executionId);

    /** PENDING | RETRYING → RUNNING */
    boolean markRunning(String executionId, int version, Instant startTime);

    /** RUNNING → COMPLETED */
    boolean markCompleted(String executionId, int version, Instant endTime, long duration,
                          String reportExecutionId, String metadata);

    /** RUNNING → FAILED */
    boolean markFailed(String executionId, int version, Instant endTime, Long duration, String error);

    /** FAILED → RETRYING, retry_count + 1 */
    boolean markRetrying(String executionId, int version, Instant nextRetryTime);

    /** PENDING | RETRYING | RUNNING → CANCELLED */
    boolean markCancelled(String executionId, int version, Instant endTime, String reason);

    /** 仅 RUNNING 有效 */
    boolean requestCancel(String executionId);

    List<ScheduleExecutionEntity> findStaleRunning(Instant startedBefore, int limit);

    List<ScheduleExecutionEntity> findDueRetries(Instant now, int limit);

    List<ScheduleExecutionEntity> findStalePending(Instant createdBefore, int limit);

    List<ScheduleExecutionEntity> findRecent(String scheduleId, int limit);

    PageResult<ScheduleExecutionEntity> page(ExecutionQuery query);

    /** status 为空时统计全部 */
    long countCreatedSince(Instant since, ExecutionStatus status);

    long countByStatus(ExecutionStatus status);

    List<String> findIdsOfSchedule(String scheduleId);

    int deleteBySchedule(String scheduleId);
}
