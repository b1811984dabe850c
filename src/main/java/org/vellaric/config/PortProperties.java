package org.vellaric.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 端口范围配置 platform.ports.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "platform.ports")
public class PortProperties {
    
    private int appMin = 3000;
    
    private int appMax = 3999;
    
    private int dbMin = 5432;
    
    private int dbMax = 6431;
}
