package org.vellaric.dao.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.vellaric.entity.EnvVariable;

/**
 * 环境变量 Mapper
 */
@Mapper
public interface EnvVariableMapper extends BaseMapper<EnvVariable> {
}
