package org.vellaric.dao.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.vellaric.entity.Deployment;

/**
 * 部署历史 Mapper
 */
@Mapper
public interface DeploymentMapper extends BaseMapper<Deployment> {
}
