package org.vellaric.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Git 拉取配置 platform.git.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "platform.git")
public class GitProperties {
    
    /**
     * 私有仓库访问令牌，以 oauth2:TOKEN@ 形式注入 http(s) 地址
     */
    private String accessToken;
    
    private String defaultBranch = "main";
}
