package com.reportwheel.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.reportwheel.model.entity.DeliveryLogEntity;
import org.apache.ibatis.annotations.Mapper;

/**
 * 只追加; 查询走 Wrapper
 */
@Mapper
public interface DeliveryLogMapper extends BaseMapper<DeliveryLogEntity> {
}
