package org.vellaric.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import org.vellaric.dto.enums.DatabaseStatus;

import java.time.LocalDateTime;

/**
 * 托管数据库实例
 */
@Data
@TableName("managed_database")
public class ManagedDatabase {
    
    @TableId(type = IdType.INPUT)
    private String id;
    
    private String name;
    
    /**
     * production / staging / development
     */
    private String environment;
    
    private String containerName;
    
    private String host;
    
    private Integer port;
    
    private String username;
    
    private String password;
    
    private String databaseName;
    
    private String volumePath;
    
    private String engineVersion;
    
    private String sslMode;
    
    private DatabaseStatus status;
    
    private LocalDateTime createdAt;
    
    private LocalDateTime updatedAt;
}
