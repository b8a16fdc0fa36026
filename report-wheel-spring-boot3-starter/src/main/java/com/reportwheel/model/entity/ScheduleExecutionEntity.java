package com.reportwheel.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.reportwheel.model.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@TableName("schedule_execution")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleExecutionEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String executionId;

    private String scheduleId;

    /** 报表系统返回的执行id */
    private String reportExecutionId;

    /**
     * 0=PENDING,1=RUNNING,2=COMPLETED,3=FAILED,4=CANCELLED,5=RETRYING
     */
    private Integer status;

    /** CRON | MANUAL */
    private String triggerType;

    private String triggeredBy;

    /** 计划触发时间 */
    private Instant scheduledTime;

    private Instant startTime;

    private Instant endTime;

    /** 毫秒 */
    private Long duration;

    /** 已重试次数 */
    private Integer retryCount;

    /** 创建时的最大重试次数快照 */
    private Integer maxAttempts;

    /** retrying 状态下的恢复时间 */
    private Instant nextRetryTime;

    /** 最后一次错误信息（截断） */
    private String errorMessage;

    /** ArtifactDescriptor JSON */
    private String executionMetadata;

    /** 协作式取消标记 */
    private Boolean cancelRequested;

    /** 乐观锁 */
    private Integer version;

    private Instant createdAt;

    private Instant updatedAt;

    public ExecutionStatus statusEnum() {
        return ExecutionStatus.of(status);
    }
}
