package com.reportwheel.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@TableName("report_schedule")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReportScheduleEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 业务可见 ScheduleId, 不可变 */
    private String scheduleId;

    /** 目标报表 */
    private String reportId;

    private String name;

    private String description;

    /** 5 段 cron 表达式 */
    private String cronExpression;

    /** IANA 时区, 如 Asia/Shanghai */
    private String timezone;

    private Boolean enabled;

    /** DeliveryConfig JSON */
    private String deliveryConfig;

    /** ReportConfig JSON */
    private String reportConfig;

    /** RetryPolicy JSON, 为空时取默认值 */
    private String retryConfig;

    /** 下次触发时间, 始终由 CronEvaluator 计算 */
    private Instant nextExecution;

    /** 上次触发时间 */
    private Instant lastExecution;

    /** 累计执行次数 */
    private Integer executionCount;

    /** 累计永久失败次数 */
    private Integer failureCount;

    /** 当前非终态执行, 为空表示空闲 */
    private String activeExecutionId;

    /** 乐观锁 */
    private Integer version;

    private Instant createdAt;

    private Instant updatedAt;

    private String createdBy;

    private String updatedBy;
}
