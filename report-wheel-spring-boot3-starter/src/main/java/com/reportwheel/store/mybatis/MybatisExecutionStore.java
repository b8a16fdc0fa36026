package com.reportwheel.store.mybatis;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.StringUtils;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.reportwheel.mapper.ScheduleExecutionMapper;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.ExecutionStatus;
import com.reportwheel.model.query.ExecutionQuery;
import com.reportwheel.model.view.PageResult;
import com.reportwheel.store.ExecutionStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class MybatisExecutionStore implements ExecutionStore {

    private final ScheduleExecutionMapper mapper;

    public MybatisExecutionStore(ScheduleExecutionMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void insert(ScheduleExecutionEntity execution) {
        mapper.insert(execution);
    }

    @Override
    public Optional<ScheduleExecutionEntity> find(String executionId) {
        return Optional.ofNullable(mapper.selectOne(new LambdaQueryWrapper<ScheduleExecutionEntity>()
                .eq(ScheduleExecutionEntity::getExecutionId, executionId)));
    }

    @Override
    public boolean markRunning(String executionId, int version, Instant startTime) {
        return mapper.markRunning(executionId, version, startTime) == 1;
    }

    @Override
    public boolean markCompleted(String executionId, int version, Instant endTime, long duration,
                                 String reportExecutionId, String metadata) {
        return mapper.markCompleted(executionId, version, endTime, duration, reportExecutionId, metadata) == 1;
    }

    @Override
    public boolean markFailed(String executionId, int version, Instant endTime, Long duration, String error) {
        return mapper.markFailed(executionId, version, endTime, duration, error) == 1;
    }

    @Override
    public boolean markRetrying(String executionId, int version, Instant nextRetryTime) {
        return mapper.markRetrying(executionId, version, nextRetryTime) == 1;
    }

    @Override
    public boolean markCancelled(String executionId, int version, Instant endTime, String reason) {
        return mapper.markCancelled(executionId, version, endTime, reason) == 1;
    }

    @Override
    public boolean requestCancel(String executionId) {
        return mapper.requestCancel(executionId) == 1;
    }

    @Override
    public List<ScheduleExecutionEntity> findStaleRunning(Instant startedBefore, int limit) {
        return mapper.findStaleRunning(startedBefore, limit);
    }

    @Override
    public List<ScheduleExecutionEntity> findDueRetries(Instant now, int limit) {
        return mapper.findDueRetries(now, limit);
    }

    @Override
    public List<ScheduleExecutionEntity> findStalePending(Instant createdBefore, int limit) {
        return mapper.findStalePending(createdBefore, limit);
    }

    @Override
    public List<ScheduleExecutionEntity> findRecent(String scheduleId, int limit) {
        return mapper.selectList(new LambdaQueryWrapper<ScheduleExecutionEntity>()
                .eq(ScheduleExecutionEntity::getScheduleId, scheduleId)
                .orderByDesc(ScheduleExecutionEntity::getCreatedAt)
                .last("LIMIT " + Math.max(1, limit)));
    }

    @Override
    public PageResult<ScheduleExecutionEntity> page(ExecutionQuery query) {
        LambdaQueryWrapper<ScheduleExecutionEntity> w = new LambdaQueryWrapper<ScheduleExecutionEntity>()
                .eq(StringUtils.isNotBlank(query.getScheduleId()), ScheduleExecutionEntity::getScheduleId, query.getScheduleId())
                .eq(query.getStatus() != null, ScheduleExecutionEntity::getStatus,
                        query.getStatus() == null ? null : query.getStatus().code)
                .orderByDesc(ScheduleExecutionEntity::getCreatedAt);
        Page<ScheduleExecutionEntity> p = mapper.selectPage(new Page<>(query.page(), query.limit()), w);
        return new PageResult<>(p.getRecords(), query.page(), query.limit(), p.getTotal());
    }

    @Override
    public long countCreatedSince(Instant since, ExecutionStatus status) {
        return mapper.selectCount(new LambdaQueryWrapper<ScheduleExecutionEntity>()
                .ge(ScheduleExecutionEntity::getCreatedAt, since)
                .eq(status != null, ScheduleExecutionEntity::getStatus, status == null ? null : status.code));
    }

    @Override
    public long countByStatus(ExecutionStatus status) {
        return mapper.selectCount(new LambdaQueryWrapper<ScheduleExecutionEntity>()
                .eq(ScheduleExecutionEntity::getStatus, status.code));
    }

    @Override
    public List<String> findIdsOfSchedule(String scheduleId) {
        return mapper.selectList(new LambdaQueryWrapper<ScheduleExecutionEntity>()
                        .select(ScheduleExecutionEntity::getExecutionId)
                        .eq(ScheduleExecutionEntity::getScheduleId, scheduleId))
                .stream()
                .map(ScheduleExecutionEntity::getExecutionId)
                .toList();
    }

    @Override
    public int deleteBySchedule(String scheduleId) {
        return mapper.delete(new LambdaQueryWrapper<ScheduleExecutionEntity>()
                .eq(ScheduleExecutionEntity::getScheduleId, scheduleId));
    }
}
