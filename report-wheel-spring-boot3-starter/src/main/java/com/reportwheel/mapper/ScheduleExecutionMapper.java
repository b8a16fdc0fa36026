package com.reportwheel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ScheduleExecutionMapper extends BaseMapper<ScheduleExecutionEntity> {

    /**
     * PENDING(0)/RETRYING(5) -> RUNNING(1)
     */
    @Update("""
        UPDATE schedule_execution
           SET status = 1,
               start_time = #{startTime},
               next_retry_time = NULL,
               updated_at = #{startTime},
               version = version + 1
         WHERE execution_id = #{executionId}
           AND status IN (0, 5)
           AND version = #{version}
    """)
    int markRunning(@Param("executionId") String executionId,
                    @Param("version") int version,
                    @Param("startTime") Instant startTime);

    /**
     * RUNNING(1) -> COMPLETED(2)
     */
    @Update("""
        UPDATE schedule_execution
           SET status = 2,
               end_time = #{endTime},
               duration = #{duration},
               report_execution_id = #{reportExecutionId},
               execution_metadata = #{metadata},
               error_message = NULL,
               updated_at = #{endTime},
               version = version + 1
         WHERE execution_id = #{executionId}
           AND status = 1
           AND version = #{version}
    """)
    int markCompleted(@Param("executionId") String executionId,
                      @Param("version") int version,
                      @Param("endTime") Instant endTime,
                      @Param("duration") long duration,
                      @Param("reportExecutionId") String reportExecutionId,
                      @Param("metadata") String metadata);

    /**
     * RUNNING(1) -> FAILED(3), 错误截断至 4000 字符
     */
    @Update("""
        UPDATE schedule_execution
           SET status = 3,
               end_time = #{endTime},
               duration = #{duration},
               error_message = LEFT(#{error}, 4000),
               updated_at = #{endTime},
               version = version + 1
         WHERE execution_id = #{executionId}
           AND status = 1
           AND version = #{version}
    """)
    int markFailed(@Param("executionId") String executionId,
                   @Param("version") int version,
                   @Param("endTime") Instant endTime,
                   @Param("duration") Long duration,
                   @Param("error") String error);

    /**
     * FAILED(3) -> RETRYING(5), 重试次数只能 +1
     */
    @Update("""
        UPDATE schedule_execution
           SET status = 5,
               retry_count = retry_count + 1,
               next_retry_time = #{nextRetryTime},
               updated_at = CURRENT_TIMESTAMP(3),
               version = version + 1
         WHERE execution_id = #{executionId}
           AND status = 3
           AND retry_count < max_attempts
           AND version = #{version}
    """)
    int markRetrying(@Param("executionId") String executionId,
                     @Param("version") int version,
                     @Param("nextRetryTime") Instant nextRetryTime);

    @Update("""
        UPDATE schedule_execution
           SET status = 4,
               end_time = #{endTime},
               error_message = LEFT(#{reason}, 4000),
               next_retry_time = NULL,
               updated_at = #{endTime},
               version = version + 1
         WHERE execution_id = #{executionId}
           AND status IN (0, 1, 5)
           AND version = #{version}
    """)
    int markCancelled(@Param("executionId") String executionId,
                      @Param("version") int version,
                      @Param("endTime") Instant endTime,
                      @Param("reason") String reason);

    @Update("""
        UPDATE schedule_execution
           SET cancel_requested = 1
         WHERE execution_id = #{executionId}
           AND status = 1
    """)
    int requestCancel(@Param("executionId") String executionId);

    /**
     * 孤儿查询
     */
    @Select("""
        SELECT * FROM schedule_execution
         WHERE status = 1
           AND start_time < #{startedBefore}
         ORDER BY start_time ASC
         LIMIT #{limit}
    """)
    List<ScheduleExecutionEntity> findStaleRunning(@Param("startedBefore") Instant startedBefore,
                                                   @Param("limit") int limit);

    @Select("""
        SELECT * FROM schedule_execution
         WHERE status = 5
           AND next_retry_time <= #{now}
         ORDER BY next_retry_time ASC
         LIMIT #{limit}
    """)
    List<ScheduleExecutionEntity> findDueRetries(@Param("now") Instant now, @Param("limit") int limit);

    @Select("""
        SELECT * FROM schedule_execution
         WHERE status = 0
           AND created_at <= #{createdBefore}
         ORDER BY created_at ASC
         LIMIT #{limit}
    """)
    List<ScheduleExecutionEntity> findStalePending(@Param("createdBefore") Instant createdBefore,
                                                   @Param("limit") int limit);
}
