package com.reportwheel.model.query;

import com.reportwheel.model.enums.ExecutionStatus;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class ExecutionQuery extends PageQuery {

    private String scheduleId;

    private ExecutionStatus status;
}
