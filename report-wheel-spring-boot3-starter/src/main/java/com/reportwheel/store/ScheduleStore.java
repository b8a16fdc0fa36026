package com.reportwheel.store;

import com.reportwheel.model.entity.ReportScheduleEntity;
import com.reportwheel.model.query.ScheduleQuery;
import com.reportwheel.model.view.PageResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 调度表, 所有跨进程互斥都通过这里的 CAS 完成
 */
public interface ScheduleStore {

    Optional<ReportScheduleEntity> find(String scheduleId);

    /**
     * 已启用且 next_execution <= now 的调度, 在事务内加行锁
     */
    List<ReportScheduleEntity> lockDue(Instant now, int limit);

    /**
     * 领取: next_execution 仍为 expectedNext 时推进到 newNext, 并记录 last_execution
     */
    boolean claimAndAdvance(String scheduleId, Instant expectedNext, Instant newNext, Instant firedAt);

    /**
     * 占用活跃执行槽: 仅当调度启用且无活跃执行时成功, 同时 execution_count + 1
     */
    boolean acquireActive(String scheduleId, String executionId, Instant now);

    /**
     * 释放活跃执行槽, 只释放自己持有的
     */
    boolean releaseActive(String scheduleId, String executionId);

    void incrementFailureCount(String scheduleId);

    /** 持有活跃执行槽的调度, 按 schedule_id 升序从 afterScheduleId 之后翻页 */
    List<ReportScheduleEntity> findClaimed(String afterScheduleId, int limit);

    void insert(ReportScheduleEntity schedule);

    /**
     * 更新定义字段（乐观锁）, 不触碰计数与活跃槽
     */
    boolean updateDefinition(ReportScheduleEntity schedule);

    boolean delete(String scheduleId);

    PageResult<ReportScheduleEntity> page(ScheduleQuery query);

    List<ReportScheduleEntity> findUpcoming(int limit);

    /** enabled 为空时统计全部 */
    long count(Boolean enabled);
}
