package com.reportwheel.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.reportwheel.model.enums.DeliveryMethodType;
import com.reportwheel.model.enums.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 每个执行每个通道一行, 唯一键 (execution_id, channel)
 */
@TableName("delivery_attempt")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAttemptEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String executionId;

    private String scheduleId;

    /** email | file_storage | api_endpoint | webhook */
    private String channel;

    /** 展示用收件人 */
    private String recipient;

    /** 0=PENDING,1=DELIVERED,2=FAILED */
    private Integer status;

    /** 已发生的尝试次数, 只增不减 */
    private Integer attemptCount;

    /** 允许的尝试总数 */
    private Integer attemptBudget;

    /** 下次可尝试时间; 进行中时为租约到期时间 */
    private Instant nextAttemptTime;

    private Instant lastAttemptTime;

    private Instant deliveredAt;

    private String lastError;

    /** 乐观锁 */
    private Integer version;

    private Instant createdAt;

    private Instant updatedAt;

    public DeliveryStatus statusEnum() {
        return DeliveryStatus.of(status);
    }

    public DeliveryMethodType channelType() {
        return DeliveryMethodType.from(channel);
    }
}
