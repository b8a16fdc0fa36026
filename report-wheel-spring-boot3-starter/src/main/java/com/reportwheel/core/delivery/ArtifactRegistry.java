package com.reportwheel.core.delivery;

import com.reportwheel.model.ReportArtifact;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 投递未结束前在内存中保留报表产物, 供通道重试复用
 * 进程重启后丢失, 由 ReportGenerator.reload 取回
 */
public class ArtifactRegistry {

    private final Map<String, ReportArtifact> artifacts = new ConcurrentHashMap<>();

    public void put(String executionId, ReportArtifact artifact) {
        artifacts.put(executionId, artifact);
    }

    public Optional<ReportArtifact> get(String executionId) {
        return Optional.ofNullable(artifacts.get(executionId));
    }

    public void release(String executionId) {
        artifacts.remove(executionId);
    }

    public int size() {
        return artifacts.size();
    }
}
