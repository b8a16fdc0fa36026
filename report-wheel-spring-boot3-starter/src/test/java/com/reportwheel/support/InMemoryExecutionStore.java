package com.reportwheel.support;

import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.model.query.ExecutionQuery;
import com.reportwheel.model.view.PageResult;
import com.reportwheel.store.ExecutionStore;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * 与 schedule_execution 上的状态迁移语句保持一致的内存实现
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, ScheduleExecutionEntity> rows = new LinkedHashMap<>();

    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized void insert(ScheduleExecutionEntity execution) {
        execution.setId(ids.incrementAndGet());
        rows.put(execution.getExecutionId(), copy(execution));
    }

    @Override
    public synchronized Optional<ScheduleExecutionEntity> find(String executionId) {
        ScheduleExecutionEntity e = executionId == null ? null : rows.get(executionId);
        return e == null ? Optional.empty() : Optional.of(copy(e));
    }

    @Override
    public synchronized boolean markRunning(String executionId, int version, Instant startTime) {
        ScheduleExecutionEntity e = match(executionId, version, Set.of(ExecutionStatus.PENDING, ExecutionStatus.RETRYING));
        if (e == null) {
            return false;
        }
        e.setStatus(ExecutionStatus.RUNNING.code);
        e.setStartTime(startTime);
        e.setNextRetryTime(null);
        e.setUpdatedAt(startTime);
        e.setVersion(e.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean markCompleted(String executionId, int version, Instant endTime, long duration,
                                              String reportExecutionId, String metadata) {
        ScheduleExecutionEntity e = match(executionId, version, Set.of(ExecutionStatus.RUNNING));
        if (e == null) {
            return false;
        }
        e.setStatus(ExecutionStatus.COMPLETED.code);
        e.setEndTime(endTime);
        e.setDuration(duration);
        e.setReportExecutionId(reportExecutionId);
        e.setExecutionMetadata(metadata);
        e.setErrorMessage(null);
        e.setUpdatedAt(endTime);
        e.setVersion(e.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean markFailed(String executionId, int version, Instant endTime, Long duration, String error) {
        ScheduleExecutionEntity e = match(executionId, version, Set.of(ExecutionStatus.RUNNING));
        if (e == null) {
            return false;
        }
        e.setStatus(ExecutionStatus.FAILED.code);
        e.setEndTime(endTime);
        e.setDuration(duration);
        e.setErrorMessage(error == null || error.length() <= 4000 ? error : error.substring(0, 4000));
        e.setUpdatedAt(endTime);
        e.setVersion(e.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean markRetrying(String executionId, int version, Instant nextRetryTime) {
        ScheduleExecutionEntity e = match(executionId, version, Set.of(ExecutionStatus.FAILED));
        if (e == null || e.getRetryCount() >= e.getMaxAttempts()) {
            return false;
        }
        e.setStatus(ExecutionStatus.RETRYING.code);
        e.setRetryCount(e.getRetryCount() + 1);
        e.setNextRetryTime(nextRetryTime);
        e.setVersion(e.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean markCancelled(String executionId, int version, Instant endTime, String reason) {
        ScheduleExecutionEntity e = match(executionId, version,
                Set.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING, ExecutionStatus.RETRYING));
        if (e == null) {
            return false;
        }
        e.setStatus(ExecutionStatus.CANCELLED.code);
        e.setEndTime(endTime);
        e.setErrorMessage(reason);
        e.setNextRetryTime(null);
        e.setUpdatedAt(endTime);
        e.setVersion(e.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean requestCancel(String executionId) {
        ScheduleExecutionEntity e = rows.get(executionId);
        if (e == null || e.statusEnum() != ExecutionStatus.RUNNING) {
            return false;
        }
        e.setCancelRequested(true);
        return true;
    }

    @Override
    public synchronized List<ScheduleExecutionEntity> findStaleRunning(Instant startedBefore, int limit) {
        return select(e -> e.statusEnum() == ExecutionStatus.RUNNING && e.getStartTime().isBefore(startedBefore),
                Comparator.comparing(ScheduleExecutionEntity::getStartTime), limit);
    }

    @Override
    public synchronized List<ScheduleExecutionEntity> findDueRetries(Instant now, int limit) {
        return select(e -> e.statusEnum() == ExecutionStatus.RETRYING && e.getNextRetryTime() != null
                        && !e.getNextRetryTime().isAfter(now),
                Comparator.comparing(ScheduleExecutionEntity::getNextRetryTime), limit);
    }

    @Override
    public synchronized List<ScheduleExecutionEntity> findStalePending(Instant createdBefore, int limit) {
        return select(e -> e.statusEnum() == ExecutionStatus.PENDING && !e.getCreatedAt().isAfter(createdBefore),
                Comparator.comparing(ScheduleExecutionEntity::getCreatedAt), limit);
    }

    @Override
    public synchronized List<ScheduleExecutionEntity> findRecent(String scheduleId, int limit) {
        return select(e -> e.getScheduleId().equals(scheduleId), newestFirst(), Math.max(1, limit));
    }

    @Override
    public synchronized PageResult<ScheduleExecutionEntity> page(ExecutionQuery query) {
        List<ScheduleExecutionEntity> all = select(e -> (query.getScheduleId() == null || query.getScheduleId().equals(e.getScheduleId()))
                        && (query.getStatus() == null || query.getStatus() == e.statusEnum()),
                newestFirst(), Integer.MAX_VALUE);
        List<ScheduleExecutionEntity> items = all.stream().skip(query.offset()).limit(query.limit()).toList();
        return new PageResult<>(items, query.page(), query.limit(), all.size());
    }

    @Override
    public synchronized long countCreatedSince(Instant since, ExecutionStatus status) {
        return rows.values().stream()
                .filter(e -> !e.getCreatedAt().isBefore(since))
                .filter(e -> status == null || e.statusEnum() == status)
                .count();
    }

    @Override
    public synchronized long countByStatus(ExecutionStatus status) {
        return rows.values().stream().filter(e -> e.statusEnum() == status).count();
    }

    @Override
    public synchronized List<String> findIdsOfSchedule(String scheduleId) {
        return rows.values().stream()
                .filter(e -> e.getScheduleId().equals(scheduleId))
                .map(ScheduleExecutionEntity::getExecutionId)
                .toList();
    }

    @Override
    public synchronized int deleteBySchedule(String scheduleId) {
        int before = rows.size();
        rows.values().removeIf(e -> e.getScheduleId().equals(scheduleId));
        return before - rows.size();
    }

    /** 测试直接改库 */
    public synchronized void put(ScheduleExecutionEntity execution) {
        rows.put(execution.getExecutionId(), copy(execution));
    }

    public synchronized List<ScheduleExecutionEntity> all() {
        return rows.values().stream().map(InMemoryExecutionStore::copy).toList();
    }

    public synchronized List<ScheduleExecutionEntity> ofSchedule(String scheduleId) {
        return rows.values().stream()
                .filter(e -> e.getScheduleId().equals(scheduleId))
                .map(InMemoryExecutionStore::copy)
                .toList();
    }

    private ScheduleExecutionEntity match(String executionId, int version, Collection<ExecutionStatus> from) {
        ScheduleExecutionEntity e = rows.get(executionId);
        if (e == null || e.getVersion() != version || !from.contains(e.statusEnum())) {
            return null;
        }
        return e;
    }

    private List<ScheduleExecutionEntity> select(Predicate<ScheduleExecutionEntity> filter,
                                                 Comparator<ScheduleExecutionEntity> order, int limit) {
        return rows.values().stream()
                .filter(filter)
                .sorted(order)
                .limit(limit)
                .map(InMemoryExecutionStore::copy)
                .toList();
    }

    private static Comparator<ScheduleExecutionEntity> newestFirst() {
        return Comparator.comparing(ScheduleExecutionEntity::getCreatedAt)
                .thenComparing(ScheduleExecutionEntity::getId)
                .reversed();
    }

    private static ScheduleExecutionEntity copy(ScheduleExecutionEntity e) {
        return e.toBuilder().build();
    }
}
