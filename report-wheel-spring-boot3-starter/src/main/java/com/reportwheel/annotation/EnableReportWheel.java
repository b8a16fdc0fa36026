package com.reportwheel.annotation;

import java.lang.annotation.*;

/**
 * 标注在启动类上, 覆盖 report.wheel.scan.enabled
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableReportWheel {

    /**
     * 是否启动到期扫描
     */
    boolean value() default true;
}
