package org.vellaric.dao.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.vellaric.entity.ManagedDatabase;

/**
 * 托管数据库 Mapper
 */
@Mapper
public interface ManagedDatabaseMapper extends BaseMapper<ManagedDatabase> {
}
