package org.vellaric.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 托管数据库配置 platform.database.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "platform.database")
public class DatabaseProperties {
    
    private String dataDir = "/var/vellaric/postgres";
    
    private String postgresVersion = "17";
    
    private String defaultEnvironment = "production";
    
    private String sslMode = "prefer";
    
    private Duration readyInterval = Duration.ofSeconds(2);
    
    private int readyMaxAttempts = 60;
    
    private int failureTailLines = 20;
}
