package com.reportwheel.model;

import com.reportwheel.model.enums.DeliveryMethodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个投递通道配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryMethod {

    private DeliveryMethodType type;

    /** 通道私有配置 */
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    /** 通道级重试覆盖, 可为空 */
    private RetryPolicy retry;
}
