package com.reportwheel.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class GenerationRequest {

    private final String executionId;

    private final String scheduleId;

    private final String reportId;

    /** 第几次运行, 从 0 开始 */
    private final int retryCount;

    private final Instant scheduledTime;

    private final ReportConfig reportConfig;

    private final String format;

    private final boolean compression;
}
