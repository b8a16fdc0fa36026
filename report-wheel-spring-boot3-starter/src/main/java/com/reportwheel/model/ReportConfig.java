package com.reportwheel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReportConfig {

    @Builder.Default
    private Map<String, Object> filters = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> formatOptions = new LinkedHashMap<>();
}
