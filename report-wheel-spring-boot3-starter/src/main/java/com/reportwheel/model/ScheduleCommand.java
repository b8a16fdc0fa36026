package com.reportwheel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建/更新调度入参; 更新时为空的字段保持不变
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleCommand {

    /** 创建时可指定, 为空则生成 */
    private String scheduleId;

    private String reportId;

    private String name;

    private String description;

    private String cronExpression;

    private String timezone;

    private Boolean enabled;

    private DeliveryConfig deliveryConfig;

    private ReportConfig reportConfig;

    private RetryPolicy retryConfig;

    /** 操作人 */
    private String operator;
}
