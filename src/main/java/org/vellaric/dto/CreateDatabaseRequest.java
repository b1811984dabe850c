package org.vellaric.dto;

import lombok.Data;

/**
 * 创建数据库请求
 */
@Data
public class CreateDatabaseRequest {
    
    private String name;
    
    /**
     * 为空时使用默认环境 production
     */
    private String environment;
}
