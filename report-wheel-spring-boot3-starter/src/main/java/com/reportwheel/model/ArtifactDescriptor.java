package com.reportwheel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 报表产物元数据, 存于 execution_metadata
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArtifactDescriptor {

    private String reportExecutionId;

    private String fileName;

    private String contentType;

    private long size;

    private Map<String, Object> metadata;
}
