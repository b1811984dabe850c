package org.vellaric.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 项目分支级环境变量
 */
@Data
@TableName("env_variable")
public class EnvVariable {
    
    @TableId(type = IdType.AUTO)
    private Long id;
    
    private String projectName;
    
    private String branch;
    
    private String varKey;
    
    private String varValue;
    
    /**
     * 是否敏感值（日志中打码）
     */
    private Boolean secret;
    
    private String description;
    
    private LocalDateTime createdAt;
    
    private LocalDateTime updatedAt;
}
