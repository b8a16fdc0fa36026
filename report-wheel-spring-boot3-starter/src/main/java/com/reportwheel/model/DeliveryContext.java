package com.reportwheel.model;

import com.reportwheel.model.enums.DeliveryMethodType;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class DeliveryContext {

    private final String executionId;

    private final String scheduleId;

    private final String scheduleName;

    private final String reportId;

    private final DeliveryMethodType channel;

    /** 本次是第几次尝试 */
    private final int attempt;

    private final int budget;

    private final Instant scheduledTime;

    private final Instant completedAt;
}
