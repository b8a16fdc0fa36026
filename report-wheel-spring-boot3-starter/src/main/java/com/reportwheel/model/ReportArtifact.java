package com.reportwheel.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * 生成器产出的报表
 */
@Getter
@Builder
public class ReportArtifact {

    private final String reportExecutionId;

    private final String fileName;

    private final String contentType;

    private final byte[] content;

    private final Map<String, Object> metadata;

    public long size() {
        return content == null ? 0 : content.length;
    }

    public ArtifactDescriptor descriptor() {
        return ArtifactDescriptor.builder()
                .reportExecutionId(reportExecutionId)
                .fileName(fileName)
                .contentType(contentType)
                .size(size())
                .metadata(metadata == null ? Map.of() : metadata)
                .build();
    }
}
