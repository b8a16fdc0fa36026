package com.reportwheel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.reportwheel.model.entity.DeliveryAttemptEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

@Mapper
public interface DeliveryAttemptMapper extends BaseMapper<DeliveryAttemptEntity> {

    /**
     * uk_execution_channel 冲突时忽略, 重复派发幂等
     */
    @Insert("""
        INSERT IGNORE INTO delivery_attempt
            (execution_id, schedule_id, channel, recipient, status, attempt_count, attempt_budget,
             next_attempt_time, version, created_at, updated_at)
        VALUES
            (#{a.executionId}, #{a.scheduleId}, #{a.channel}, #{a.recipient}, #{a.status}, #{a.attemptCount},
             #{a.attemptBudget}, #{a.nextAttemptTime}, 0, #{a.createdAt}, #{a.createdAt})
    """)
    int insertIgnore(@Param("a") DeliveryAttemptEntity attempt);

    /**
     * 开始一次尝试, 预算用尽时不再递增
     */
    @Update("""
        UPDATE delivery_attempt
           SET attempt_count = attempt_count + 1,
               last_attempt_time = #{now},
               next_attempt_time = #{leaseUntil},
               updated_at = #{now},
               version = version + 1
         WHERE id = #{id}
           AND status = 0
           AND attempt_count < attempt_budget
           AND version = #{version}
    """)
    int beginAttempt(@Param("id") Long id, @Param("version") int version,
                     @Param("now") Instant now, @Param("leaseUntil") Instant leaseUntil);

    @Update("""
        UPDATE delivery_attempt
           SET status = 1,
               delivered_at = #{deliveredAt},
               next_attempt_time = NULL,
               last_error = NULL,
               updated_at = #{deliveredAt},
               version = version + 1
         WHERE id = #{id}
           AND status = 0
           AND version = #{version}
    """)
    int markDelivered(@Param("id") Long id, @Param("version") int version, @Param("deliveredAt") Instant deliveredAt);

    @Update("""
        UPDATE delivery_attempt
           SET next_attempt_time = #{nextAttemptTime},
               last_error = LEFT(#{error}, 4000),
               updated_at = CURRENT_TIMESTAMP(3),
               version = version + 1
         WHERE id = #{id}
           AND status = 0
           AND version = #{version}
    """)
    int markRetryPending(@Param("id") Long id, @Param("version") int version,
                         @Param("nextAttemptTime") Instant nextAttemptTime, @Param("error") String error);

    @Update("""
        UPDATE delivery_attempt
           SET status = 2,
               next_attempt_time = NULL,
               last_error = LEFT(#{error}, 4000),
               updated_at = CURRENT_TIMESTAMP(3),
               version = version + 1
         WHERE id = #{id}
           AND status = 0
           AND version = #{version}
    """)
    int markFailed(@Param("id") Long id, @Param("version") int version, @Param("error") String error);

    /**
     * 手动重试: FAILED(2) -> PENDING(0), 预算只能大于已用次数
     */
    @Update("""
        UPDATE delivery_attempt
           SET status = 0,
               attempt_budget = #{budget},
               next_attempt_time = #{now},
               updated_at = #{now},
               version = version + 1
         WHERE id = #{id}
           AND status = 2
           AND attempt_count < #{budget}
           AND version = #{version}
    """)
    int reopen(@Param("id") Long id, @Param("version") int version,
               @Param("budget") int budget, @Param("now") Instant now);

    @Select("""
        SELECT * FROM delivery_attempt
         WHERE status = 0
           AND next_attempt_time <= #{now}
         ORDER BY next_attempt_time ASC
         LIMIT #{limit}
    """)
    List<DeliveryAttemptEntity> findDue(@Param("now") Instant now, @Param("limit") int limit);
}
