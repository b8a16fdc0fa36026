package com.reportwheel.autoconfig;

import com.reportwheel.config.ReportWheelProperties;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@AutoConfiguration(after = TransactionAutoConfiguration.class)
@EnableConfigurationProperties(ReportWheelProperties.class)
@ConditionalOnClass({TransactionTemplate.class, PlatformTransactionManager.class})
@ConditionalOnBean(PlatformTransactionManager.class)
public class ReportTxAutoConfiguration {

    /** 领取、状态迁移与级联删除共用的编程式事务模板 */
    @Bean
    @ConditionalOnMissingBean(TransactionTemplate.class)
    public TransactionTemplate transactionTemplate(PlatformTransactionManager tm,
                                                   ReportWheelProperties props) {
        TransactionTemplate tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(props.getTx().getPropagation().value());
        tpl.setIsolationLevel(props.getTx().getIsolation().value());
        if (props.getTx().getTimeoutSeconds() > 0) {
            tpl.setTimeout(props.getTx().getTimeoutSeconds());
        }
        return tpl;
    }
}
