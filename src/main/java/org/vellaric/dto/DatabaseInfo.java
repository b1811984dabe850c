package org.vellaric.dto;

import lombok.Data;
import org.vellaric.dto.enums.DatabaseStatus;

import java.time.LocalDateTime;

/**
 * 数据库实例信息（不含密码）
 */
@Data
public class DatabaseInfo {
    
    private String id;
    
    private String name;
    
    private String environment;
    
    private String containerName;
    
    private String host;
    
    private Integer port;
    
    private String username;
    
    private String database;
    
    private String sslMode;
    
    private String engineVersion;
    
    private DatabaseStatus status;
    
    private LocalDateTime createdAt;
}
