package com.reportwheel.store.mybatis;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.StringUtils;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.reportwheel.mapper.DeliveryAttemptMapper;
import com.reportwheel.mapper.DeliveryLogMapper;
import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.entity.DeliveryLogEntity;
import com.reportwheel.model.enums.DeliveryStatus;
import com.reportwheel.model.query.DeliveryLogQuery;
import com.reportwheel.model.view.PageResult;
import com.reportwheel.store.DeliveryStore;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public class MybatisDeliveryStore implements DeliveryStore {

    private final DeliveryAttemptMapper attemptMapper;

    private final DeliveryLogMapper logMapper;

    public MybatisDeliveryStore(DeliveryAttemptMapper attemptMapper, DeliveryLogMapper logMapper) {
        this.attemptMapper = attemptMapper;
        this.logMapper = logMapper;
    }

    @Override
    public int insertAttemptsIfAbsent(List<DeliveryAttemptEntity> attempts) {
        int n = 0;
        for (DeliveryAttemptEntity a : attempts) {
            n += attemptMapper.insertIgnore(a);
        }
        return n;
    }

    @Override
    public Optional<DeliveryAttemptEntity> findAttempt(String executionId, String channel) {
        return Optional.ofNullable(attemptMapper.selectOne(new LambdaQueryWrapper<DeliveryAttemptEntity>()
                .eq(DeliveryAttemptEntity::getExecutionId, executionId)
                .eq(DeliveryAttemptEntity::getChannel, channel)));
    }

    @Override
    public List<DeliveryAttemptEntity> findAttempts(String executionId) {
        return attemptMapper.selectList(new LambdaQueryWrapper<DeliveryAttemptEntity>()
                .eq(DeliveryAttemptEntity::getExecutionId, executionId)
                .orderByAsc(DeliveryAttemptEntity::getId));
    }

    @Override
    public List<DeliveryAttemptEntity> findAttempts(Collection<String> executionIds) {
        if (executionIds == null || executionIds.isEmpty()) {
            return List.of();
        }
        return attemptMapper.selectList(new LambdaQueryWrapper<DeliveryAttemptEntity>()
                .in(DeliveryAttemptEntity::getExecutionId, executionIds)
                .orderByAsc(DeliveryAttemptEntity::getId));
    }

    @Override
    public boolean beginAttempt(Long id, int version, Instant now, Instant leaseUntil) {
        return attemptMapper.beginAttempt(id, version, now, leaseUntil) == 1;
    }

    @Override
    public boolean markDelivered(Long id, int version, Instant deliveredAt) {
        return attemptMapper.markDelivered(id, version, deliveredAt) == 1;
    }

    @Override
    public boolean markRetryPending(Long id, int version, Instant nextAttemptTime, String error) {
        return attemptMapper.markRetryPending(id, version, nextAttemptTime, error) == 1;
    }

    @Override
    public boolean markFailed(Long id, int version, String error) {
        return attemptMapper.markFailed(id, version, error) == 1;
    }

    @Override
    public boolean reopen(Long id, int version, int budget, Instant now) {
        return attemptMapper.reopen(id, version, budget, now) == 1;
    }

    @Override
    public List<DeliveryAttemptEntity> findDue(Instant now, int limit) {
        return attemptMapper.findDue(now, limit);
    }

    @Override
    public void appendLog(DeliveryLogEntity log) {
        logMapper.insert(log);
    }

    @Override
    public Optional<DeliveryLogEntity> findLog(String logId) {
        return Optional.ofNullable(logMapper.selectOne(new LambdaQueryWrapper<DeliveryLogEntity>()
                .eq(DeliveryLogEntity::getLogId, logId)));
    }

    @Override
    public List<DeliveryLogEntity> findLogs(Collection<String> executionIds) {
        if (executionIds == null || executionIds.isEmpty()) {
            return List.of();
        }
        return logMapper.selectList(new LambdaQueryWrapper<DeliveryLogEntity>()
                .in(DeliveryLogEntity::getExecutionId, executionIds)
                .orderByAsc(DeliveryLogEntity::getId));
    }

    @Override
    public PageResult<DeliveryLogEntity> pageLogs(DeliveryLogQuery query) {
        LambdaQueryWrapper<DeliveryLogEntity> w = new LambdaQueryWrapper<DeliveryLogEntity>()
                .eq(query.getStatus() != null, DeliveryLogEntity::getStatus,
                        query.getStatus() == null ? null : query.getStatus().code)
                .eq(query.getMethod() != null, DeliveryLogEntity::getDeliveryMethod,
                        query.getMethod() == null ? null : query.getMethod().code())
                .eq(StringUtils.isNotBlank(query.getExecutionId()), DeliveryLogEntity::getExecutionId, query.getExecutionId())
                .orderByDesc(DeliveryLogEntity::getCreatedAt);
        Page<DeliveryLogEntity> p = logMapper.selectPage(new Page<>(query.page(), query.limit()), w);
        return new PageResult<>(p.getRecords(), query.page(), query.limit(), p.getTotal());
    }

    @Override
    public long countAttemptsCreatedSince(Instant since, DeliveryStatus status) {
        return attemptMapper.selectCount(new LambdaQueryWrapper<DeliveryAttemptEntity>()
                .ge(DeliveryAttemptEntity::getCreatedAt, since)
                .eq(status != null, DeliveryAttemptEntity::getStatus, status == null ? null : status.code));
    }

    @Override
    public int deleteByExecutions(Collection<String> executionIds) {
        if (executionIds == null || executionIds.isEmpty()) {
            return 0;
        }
        int n = attemptMapper.delete(new LambdaQueryWrapper<DeliveryAttemptEntity>()
                .in(DeliveryAttemptEntity::getExecutionId, executionIds));
        n += logMapper.delete(new LambdaQueryWrapper<DeliveryLogEntity>()
                .in(DeliveryLogEntity::getExecutionId, executionIds));
        return n;
    }
}
