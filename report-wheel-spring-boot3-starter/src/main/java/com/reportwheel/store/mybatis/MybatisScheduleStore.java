package com.reportwheel.store.mybatis;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.StringUtils;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.reportwheel.mapper.ReportScheduleMapper;
import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.query.ScheduleQuery;
import com.reportwheel.model.view.PageResult;
import com.reportwheel.store.ScheduleStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class MybatisScheduleStore implements ScheduleStore {

    private final ReportScheduleMapper mapper;

    public MybatisScheduleStore(ReportScheduleMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<ReportScheduleEntity> find(String scheduleId) {
        return Optional.ofNullable(mapper.selectOne(new LambdaQueryWrapper<ReportScheduleEntity>()
                .eq(ReportScheduleEntity::getScheduleId, scheduleId)));
    }

    @Override
    public List<ReportScheduleEntity> lockDue(Instant now, int limit) {
        return mapper.lockDue(now, limit);
    }

    @Override
    public boolean claimAndAdvance(String scheduleId, Instant expectedNext, Instant newNext, Instant firedAt) {
        return mapper.claimAndAdvance(scheduleId, expectedNext, newNext, firedAt) == 1;
    }

    @Override
    public boolean acquireActive(String scheduleId, String executionId, Instant now) {
        return mapper.acquireActive(scheduleId, executionId, now) == 1;
    }

    @Override
    public boolean releaseActive(String scheduleId, String executionId) {
        return mapper.releaseActive(scheduleId, executionId) == 1;
    }

    @Override
    public void incrementFailureCount(String scheduleId) {
        mapper.incrementFailureCount(scheduleId);
    }

    @Override
    public List<ReportScheduleEntity> findClaimed(String afterScheduleId, int limit) {
        return mapper.findClaimed(afterScheduleId == null ? "" : afterScheduleId, limit);
    }

    @Override
    public void insert(ReportScheduleEntity schedule) {
        mapper.insert(schedule);
    }

    @Override
    public boolean updateDefinition(ReportScheduleEntity schedule) {
        return mapper.updateDefinition(schedule) == 1;
    }

    @Override
    public boolean delete(String scheduleId) {
        return mapper.delete(new LambdaQueryWrapper<ReportScheduleEntity>()
                .eq(ReportScheduleEntity::getScheduleId, scheduleId)) > 0;
    }

    @Override
    public PageResult<ReportScheduleEntity> page(ScheduleQuery query) {
        LambdaQueryWrapper<ReportScheduleEntity> w = new LambdaQueryWrapper<ReportScheduleEntity>()
                .eq(query.getEnabled() != null, ReportScheduleEntity::getEnabled, query.getEnabled())
                .eq(StringUtils.isNotBlank(query.getReportId()), ReportScheduleEntity::getReportId, query.getReportId());
        if (StringUtils.isNotBlank(query.getSearch())) {
            w.and(q -> q.like(ReportScheduleEntity::getName, query.getSearch())
                    .or()
                    .like(ReportScheduleEntity::getDescription, query.getSearch()));
        }
        w.orderByDesc(ReportScheduleEntity::getCreatedAt);
        Page<ReportScheduleEntity> p = mapper.selectPage(new Page<>(query.page(), query.limit()), w);
        return new PageResult<>(p.getRecords(), query.page(), query.limit(), p.getTotal());
    }

    @Override
    public List<ReportScheduleEntity> findUpcoming(int limit) {
        return mapper.selectList(new LambdaQueryWrapper<ReportScheduleEntity>()
                .eq(ReportScheduleEntity::getEnabled, true)
                .isNotNull(ReportScheduleEntity::getNextExecution)
                .orderByAsc(ReportScheduleEntity::getNextExecution)
                .last("LIMIT " + Math.max(1, limit)));
    }

    @Override
    public long count(Boolean enabled) {
        return mapper.selectCount(new LambdaQueryWrapper<ReportScheduleEntity>()
                .eq(enabled != null, ReportScheduleEntity::getEnabled, enabled));
    }
}
