package com.reportwheel.model.query;

import com.reportwheel.model.enums.DeliveryLogStatus;
import com.reportwheel.model.enums.DeliveryMethodType;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class DeliveryLogQuery extends PageQuery {

    private DeliveryLogStatus status;

    private DeliveryMethodType method;

    private String executionId;
}
