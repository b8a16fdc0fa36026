package com.reportwheel.support;

import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.entity.DeliveryLogEntity;
import com.reportwheel.model.enums.DeliveryStatus;
import com.reportwheel.model.query.DeliveryLogQuery;
import com.reportwheel.model.view.PageResult;
import com.reportwheel.store.DeliveryStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 与 delivery_attempt / delivery_log 上的语句保持一致的内存实现
 */
public class InMemoryDeliveryStore implements DeliveryStore {

    private final List<DeliveryAttemptEntity> attempts = new ArrayList<>();

    private final List<DeliveryLogEntity> logs = new ArrayList<>();

    private final AtomicLong attemptIds = new AtomicLong();

    private final AtomicLong logIds = new AtomicLong();

    @Override
    public synchronized int insertAttemptsIfAbsent(List<DeliveryAttemptEntity> rows) {
        int n = 0;
        for (DeliveryAttemptEntity a : rows) {
            boolean exists = attempts.stream().anyMatch(x -> x.getExecutionId().equals(a.getExecutionId())
                    && x.getChannel().equals(a.getChannel()));
            if (exists) {
                continue;
            }
            DeliveryAttemptEntity row = a.toBuilder()
                    .id(attemptIds.incrementAndGet())
                    .version(0)
                    .updatedAt(a.getCreatedAt())
                    .build();
            attempts.add(row);
            n++;
        }
        return n;
    }

    @Override
    public synchronized Optional<DeliveryAttemptEntity> findAttempt(String executionId, String channel) {
        return attempts.stream()
                .filter(a -> a.getExecutionId().equals(executionId) && a.getChannel().equals(channel))
                .findFirst()
                .map(InMemoryDeliveryStore::copy);
    }

    @Override
    public synchronized List<DeliveryAttemptEntity> findAttempts(String executionId) {
        return findAttempts(List.of(executionId));
    }

    @Override
    public synchronized List<DeliveryAttemptEntity> findAttempts(Collection<String> executionIds) {
        return attempts.stream()
                .filter(a -> executionIds.contains(a.getExecutionId()))
                .sorted(Comparator.comparing(DeliveryAttemptEntity::getId))
                .map(InMemoryDeliveryStore::copy)
                .toList();
    }

    @Override
    public synchronized boolean beginAttempt(Long id, int version, Instant now, Instant leaseUntil) {
        DeliveryAttemptEntity a = match(id, version, DeliveryStatus.PENDING);
        if (a == null || a.getAttemptCount() >= a.getAttemptBudget()) {
            return false;
        }
        a.setAttemptCount(a.getAttemptCount() + 1);
        a.setLastAttemptTime(now);
        a.setNextAttemptTime(leaseUntil);
        a.setUpdatedAt(now);
        a.setVersion(a.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean markDelivered(Long id, int version, Instant deliveredAt) {
        DeliveryAttemptEntity a = match(id, version, DeliveryStatus.PENDING);
        if (a == null) {
            return false;
        }
        a.setStatus(DeliveryStatus.DELIVERED.code);
        a.setDeliveredAt(deliveredAt);
        a.setNextAttemptTime(null);
        a.setLastError(null);
        a.setUpdatedAt(deliveredAt);
        a.setVersion(a.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean markRetryPending(Long id, int version, Instant nextAttemptTime, String error) {
        DeliveryAttemptEntity a = match(id, version, DeliveryStatus.PENDING);
        if (a == null) {
            return false;
        }
        a.setNextAttemptTime(nextAttemptTime);
        a.setLastError(error);
        a.setVersion(a.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean markFailed(Long id, int version, String error) {
        DeliveryAttemptEntity a = match(id, version, DeliveryStatus.PENDING);
        if (a == null) {
            return false;
        }
        a.setStatus(DeliveryStatus.FAILED.code);
        a.setNextAttemptTime(null);
        a.setLastError(error);
        a.setVersion(a.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized boolean reopen(Long id, int version, int budget, Instant now) {
        DeliveryAttemptEntity a = match(id, version, DeliveryStatus.FAILED);
        if (a == null || a.getAttemptCount() >= budget) {
            return false;
        }
        a.setStatus(DeliveryStatus.PENDING.code);
        a.setAttemptBudget(budget);
        a.setNextAttemptTime(now);
        a.setUpdatedAt(now);
        a.setVersion(a.getVersion() + 1);
        return true;
    }

    @Override
    public synchronized List<DeliveryAttemptEntity> findDue(Instant now, int limit) {
        return attempts.stream()
                .filter(a -> a.statusEnum() == DeliveryStatus.PENDING)
                .filter(a -> a.getNextAttemptTime() != null && !a.getNextAttemptTime().isAfter(now))
                .sorted(Comparator.comparing(DeliveryAttemptEntity::getNextAttemptTime))
                .limit(limit)
                .map(InMemoryDeliveryStore::copy)
                .toList();
    }

    @Override
    public synchronized void appendLog(DeliveryLogEntity log) {
        log.setId(logIds.incrementAndGet());
        logs.add(log.toBuilder().build());
    }

    @Override
    public synchronized Optional<DeliveryLogEntity> findLog(String logId) {
        return logs.stream()
                .filter(l -> l.getLogId().equals(logId))
                .findFirst()
                .map(l -> l.toBuilder().build());
    }

    @Override
    public synchronized List<DeliveryLogEntity> findLogs(Collection<String> executionIds) {
        return logs.stream()
                .filter(l -> executionIds.contains(l.getExecutionId()))
                .sorted(Comparator.comparing(DeliveryLogEntity::getId))
                .map(l -> l.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized PageResult<DeliveryLogEntity> pageLogs(DeliveryLogQuery query) {
        List<DeliveryLogEntity> all = logs.stream()
                .filter(l -> query.getStatus() == null || query.getStatus().code == l.getStatus())
                .filter(l -> query.getMethod() == null || query.getMethod().code().equals(l.getDeliveryMethod()))
                .filter(l -> query.getExecutionId() == null || query.getExecutionId().equals(l.getExecutionId()))
                .sorted(Comparator.comparing(DeliveryLogEntity::getCreatedAt)
                        .thenComparing(DeliveryLogEntity::getId).reversed())
                .map(l -> l.toBuilder().build())
                .toList();
        List<DeliveryLogEntity> items = all.stream().skip(query.offset()).limit(query.limit()).toList();
        return new PageResult<>(items, query.page(), query.limit(), all.size());
    }

    @Override
    public synchronized long countAttemptsCreatedSince(Instant since, DeliveryStatus status) {
        return attempts.stream()
                .filter(a -> !a.getCreatedAt().isBefore(since))
                .filter(a -> status == null || a.statusEnum() == status)
                .count();
    }

    @Override
    public synchronized int deleteByExecutions(Collection<String> executionIds) {
        int before = attempts.size() + logs.size();
        attempts.removeIf(a -> executionIds.contains(a.getExecutionId()));
        logs.removeIf(l -> executionIds.contains(l.getExecutionId()));
        return before - attempts.size() - logs.size();
    }

    /** 测试直接改库 */
    public synchronized void update(DeliveryAttemptEntity attempt) {
        attempts.replaceAll(a -> Objects.equals(a.getId(), attempt.getId()) ? copy(attempt) : a);
    }

    public synchronized List<DeliveryLogEntity> logs() {
        return logs.stream().map(l -> l.toBuilder().build()).toList();
    }

    private DeliveryAttemptEntity match(Long id, int version, DeliveryStatus from) {
        return attempts.stream()
                .filter(a -> a.getId().equals(id) && a.getVersion() == version && a.statusEnum() == from)
                .findFirst()
                .orElse(null);
    }

    private static DeliveryAttemptEntity copy(DeliveryAttemptEntity a) {
        return a.toBuilder().build();
    }
}
