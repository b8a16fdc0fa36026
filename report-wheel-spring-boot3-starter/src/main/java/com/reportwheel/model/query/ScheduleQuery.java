package com.reportwheel.model.query;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class ScheduleQuery extends PageQuery {

    private Boolean enabled;

    private String reportId;

    /** name/description 模糊匹配 */
    private String search;
}
