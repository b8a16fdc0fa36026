package com.reportwheel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.reportwheel.model.entity.ReportScheduleEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ReportScheduleMapper extends BaseMapper<ReportScheduleEntity> {

    /**
     * 锁定到期调度（同一事务内随后 claimAndAdvance）
     */
    @Select("""
        SELECT * FROM report_schedule
         WHERE enabled = 1
           AND next_execution IS NOT NULL
           AND next_execution <= #{now}
         ORDER BY next_execution ASC
         LIMIT #{limit}
         FOR UPDATE SKIP LOCKED
    """)
    List<ReportScheduleEntity> lockDue(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * 领取并推进：仅当 next_execution 未被他人改动
     */
    @Update("""
        UPDATE report_schedule
           SET next_execution = #{newNext},
               last_execution = #{firedAt},
               updated_at = #{firedAt},
               version = version + 1
         WHERE schedule_id = #{scheduleId}
           AND enabled = 1
           AND next_execution = #{expectedNext}
    """)
    int claimAndAdvance(@Param("scheduleId") String scheduleId,
                        @Param("expectedNext") Instant expectedNext,
                        @Param("newNext") Instant newNext,
                        @Param("firedAt") Instant firedAt);

    /**
     * 占用活跃执行槽
     */
    @Update("""
        UPDATE report_schedule
           SET active_execution_id = #{executionId},
               execution_count = execution_count + 1,
               updated_at = #{now}
         WHERE schedule_id = #{scheduleId}
           AND enabled = 1
           AND active_execution_id IS NULL
    """)
    int acquireActive(@Param("scheduleId") String scheduleId,
                      @Param("executionId") String executionId,
                      @Param("now") Instant now);

    @Update("""
        UPDATE report_schedule
           SET active_execution_id = NULL
         WHERE schedule_id = #{scheduleId}
           AND active_execution_id = #{executionId}
    """)
    int releaseActive(@Param("scheduleId") String scheduleId, @Param("executionId") String executionId);

    @Update("UPDATE report_schedule SET failure_count = failure_count + 1 WHERE schedule_id = #{scheduleId}")
    int incrementFailureCount(@Param("scheduleId") String scheduleId);

    @Select("""
        SELECT * FROM report_schedule
         WHERE active_execution_id IS NOT NULL
           AND schedule_id > #{after}
         ORDER BY schedule_id ASC
         LIMIT #{limit}
    """)
    List<ReportScheduleEntity> findClaimed(@Param("after") String afterScheduleId, @Param("limit") int limit);

    /**
     * 只更新定义字段; 计数与活跃槽由上面的 CAS 维护
     */
    @Update("""
        UPDATE report_schedule
           SET report_id = #{s.reportId},
               name = #{s.name},
               description = #{s.description},
               cron_expression = #{s.cronExpression},
               timezone = #{s.timezone},
               enabled = #{s.enabled},
               delivery_config = #{s.deliveryConfig},
               report_config = #{s.reportConfig},
               retry_config = #{s.retryConfig},
               next_execution = #{s.nextExecution},
               updated_by = #{s.updatedBy},
               updated_at = #{s.updatedAt},
               version = version + 1
         WHERE schedule_id = #{s.scheduleId}
           AND version = #{s.version}
    """)
    int updateDefinition(@Param("s") ReportScheduleEntity schedule);
}
