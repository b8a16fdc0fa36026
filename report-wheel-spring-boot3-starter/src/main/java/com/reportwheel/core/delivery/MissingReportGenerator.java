package com.reportwheel.core.delivery;

import com.reportwheel.core.spi.ReportGenerator;
import com.reportwheel.exception.ReportGenerationException;
import com.reportwheel.model.CancellationSignal;
import com.reportwheel.model.GenerationRequest;
import com.reportwheel.model.ReportArtifact;

/**
 * 未注册 ReportGenerator 时的占位, 直接以不可重试失败结束执行
 */
public class MissingReportGenerator implements ReportGenerator {

    @Override
    public ReportArtifact generate(GenerationRequest request, CancellationSignal signal) {
        throw new ReportGenerationException("No ReportGenerator bean registered, report "
                + request.getReportId() + " cannot be generated", false);
    }
}
