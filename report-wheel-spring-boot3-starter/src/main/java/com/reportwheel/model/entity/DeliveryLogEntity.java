package com.reportwheel.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 投递日志, 只追加
 */
@TableName("delivery_log")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryLogEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String logId;

    private String executionId;

    private String scheduleId;

    private String deliveryMethod;

    private String recipient;

    /** 0=PENDING,1=DELIVERED,2=FAILED,3=RETRYING */
    private Integer status;

    /** 第几次尝试 */
    private Integer attemptNumber;

    private Instant deliveredAt;

    private String errorMessage;

    /** http status / file path / message id 等 */
    private String deliveryMetadata;

    private Instant createdAt;
}
