package com.reportwheel.core.spi;

import com.reportwheel.exception.ReportGenerationException;
import com.reportwheel.model.ArtifactDescriptor;
import com.reportwheel.model.CancellationSignal;
import com.reportwheel.model.GenerationRequest;
import com.reportwheel.model.ReportArtifact;

/**
 * 报表生成 SPI（由业务实现）
 * 失败时抛出 ReportGenerationException 并标明是否可重试; 其他异常按可重试处理
 */
public interface ReportGenerator {

    /**
     * 生成报表, 长耗时实现应周期性检查 signal
     */
    ReportArtifact generate(GenerationRequest request, CancellationSignal signal) throws Exception;

    /**
     * 进程重启后投递重试需要重新取回产物
     */
    default ReportArtifact reload(ArtifactDescriptor descriptor) throws Exception {
        throw new ReportGenerationException("Report artifact " + descriptor.getReportExecutionId()
                + " is no longer available", false);
    }
}
