package com.reportwheel.model.view;

import com.reportwheel.model.entity.DeliveryLogEntity;
import com.reportwheel.model.entity.ScheduleExecutionEntity;
import com.reportwheel.model.enums.DeliveryMethodType;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@Builder
public class ExecutionView {

    private final ScheduleExecutionEntity execution;

    /** 通道 -> 状态, 按配置顺序 */
    private final Map<DeliveryMethodType, ChannelState> deliveryStatus;

    private final List<DeliveryLogEntity> deliveryLogs;
}
