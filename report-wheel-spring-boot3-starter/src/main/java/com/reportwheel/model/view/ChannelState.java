package com.reportwheel.model.view;

import com.reportwheel.model.entity.DeliveryAttemptEntity;
import com.reportwheel.model.enums.DeliveryStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 执行视图中的单通道状态
 */
@Getter
@Builder
public class ChannelState {

    private final DeliveryStatus status;

    private final int attempts;

    private final int budget;

    private final Instant lastAttempt;

    private final String error;

    public static ChannelState of(DeliveryAttemptEntity a) {
        return ChannelState.builder()
                .status(a.statusEnum())
                .attempts(a.getAttemptCount() == null ? 0 : a.getAttemptCount())
                .budget(a.getAttemptBudget() == null ? 0 : a.getAttemptBudget())
                .lastAttempt(a.getLastAttemptTime())
                .error(a.getLastError())
                .build();
    }
}
