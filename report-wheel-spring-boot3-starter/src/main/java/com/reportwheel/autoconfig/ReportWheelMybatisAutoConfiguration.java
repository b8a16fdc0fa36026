package com.reportwheel.autoconfig;

import com.baomidou.mybatisplus.annotation.DbType;
import com.baomidou.mybatisplus.extension.plugins.MybatisPlusInterceptor;
import com.baomidou.mybatisplus.extension.plugins.inner.PaginationInnerInterceptor;
import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.reportwheel.mapper.DeliveryAttemptMapper;
import com.reportwheel.mapper.DeliveryLogMapper;
import com.reportwheel.mapper.ReportScheduleMapper;
import com.reportwheel.mapper.ScheduleExecutionMapper;
import com.reportwheel.store.DeliveryStore;
import com.reportwheel.store.ExecutionStore;
import com.reportwheel.store.ScheduleStore;
import com.reportwheel.store.mybatis.MybatisDeliveryStore;
import com.reportwheel.store.mybatis.MybatisExecutionStore;
import com.reportwheel.store.mybatis.MybatisScheduleStore;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * MySQL 存储: mapper 扫描、分页插件、三个 Store
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean(DataSource.class)
@MapperScan(basePackages = "com.reportwheel.mapper")
public class ReportWheelMybatisAutoConfiguration {

    /** selectPage 依赖分页插件 */
    @Bean
    @ConditionalOnMissingBean(MybatisPlusInterceptor.class)
    public MybatisPlusInterceptor mybatisPlusInterceptor() {
        MybatisPlusInterceptor interceptor = new MybatisPlusInterceptor();
        interceptor.addInnerInterceptor(new PaginationInnerInterceptor(DbType.MYSQL));
        return interceptor;
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleStore.class)
    public ScheduleStore scheduleStore(ReportScheduleMapper mapper) {
        return new MybatisScheduleStore(mapper);
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionStore.class)
    public ExecutionStore executionStore(ScheduleExecutionMapper mapper) {
        return new MybatisExecutionStore(mapper);
    }

    @Bean
    @ConditionalOnMissingBean(DeliveryStore.class)
    public DeliveryStore deliveryStore(DeliveryAttemptMapper attemptMapper, DeliveryLogMapper logMapper) {
        return new MybatisDeliveryStore(attemptMapper, logMapper);
    }
}
