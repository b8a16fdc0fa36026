package com.reportwheel.support;

import com.reportwheel.core.spi.ReportGenerator;
import com.reportwheel.model.ArtifactDescriptor;
import com.reportwheel.model.CancellationSignal;
import com.reportwheel.model.GenerationRequest;
import com.reportwheel.model.ReportArtifact;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * 按脚本返回产物或抛出异常; 脚本用完后返回默认产物
 */
public class ScriptedGenerator implements ReportGenerator {

    public interface Step {
        ReportArtifact run(GenerationRequest request, CancellationSignal signal) throws Exception;
    }

    private final Deque<Step> steps = new ArrayDeque<>();

    private final List<GenerationRequest> requests = new ArrayList<>();

    private final List<ArtifactDescriptor> reloaded = new ArrayList<>();

    private boolean reloadable = true;

    public static ReportArtifact artifact(String reportExecutionId) {
        return ReportArtifact.builder()
                .reportExecutionId(reportExecutionId)
                .fileName("sales.csv")
                .contentType("text/csv")
                .content("region,total\nnorth,42\n".getBytes(StandardCharsets.UTF_8))
                .metadata(Map.of("rows", 1))
                .build();
    }

    public synchronized ScriptedGenerator then(Step step) {
        steps.add(step);
        return this;
    }

    public ScriptedGenerator thenFail(Exception e) {
        return then((r, s) -> {
            throw e;
        });
    }

    public ScriptedGenerator thenReturn(ReportArtifact artifact) {
        return then((r, s) -> artifact);
    }

    public void setReloadable(boolean reloadable) {
        this.reloadable = reloadable;
    }

    @Override
    public ReportArtifact generate(GenerationRequest request, CancellationSignal signal) throws Exception {
        Step step;
        synchronized (this) {
            requests.add(request);
            step = steps.poll();
        }
        if (step == null) {
            return artifact("rx-" + request.getExecutionId());
        }
        return step.run(request, signal);
    }

    @Override
    public ReportArtifact reload(ArtifactDescriptor descriptor) throws Exception {
        if (!reloadable) {
            return ReportGenerator.super.reload(descriptor);
        }
        synchronized (this) {
            reloaded.add(descriptor);
        }
        return artifact(descriptor.getReportExecutionId());
    }

    public synchronized List<GenerationRequest> requests() {
        return new ArrayList<>(requests);
    }

    public synchronized List<ArtifactDescriptor> reloaded() {
        return new ArrayList<>(reloaded);
    }
}
