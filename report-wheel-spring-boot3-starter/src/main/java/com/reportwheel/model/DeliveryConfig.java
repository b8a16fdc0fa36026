package com.reportwheel.model;

import com.reportwheel.model.enums.DeliveryMethodType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 投递配置, methods 有序
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryConfig {

    @Builder.Default
    private List<DeliveryMethod> methods = new ArrayList<>();

    /** pdf | excel | csv ... 透传给生成器 */
    private String format;

    private Boolean compression;

    public Optional<DeliveryMethod> find(DeliveryMethodType type) {
        if (methods == null) {
            return Optional.empty();
        }
        return methods.stream().filter(m -> m.getType() == type).findFirst();
    }
}
