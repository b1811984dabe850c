package org.vellaric.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 部署相关配置 platform.deploy.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "platform.deploy")
public class DeployProperties {
    
    /**
     * 同时构建的最大部署数
     */
    private int maxConcurrent = 3;
    
    /**
     * 源码工作区根目录
     */
    private String basePath = "/var/vellaric/apps";
    
    /**
     * Dockerfile 未声明 EXPOSE 时使用的容器端口
     */
    private int defaultAppPort = 3000;
    
    /**
     * 新请求到来时取消同一项目分支正在进行的构建
     */
    private boolean supersedeInFlight = true;
    
    /**
     * 单条部署日志保留条数
     */
    private int logsPerDeployment = 500;
    
    /**
     * 部署结束后日志与记录的保留时长
     */
    private Duration retention = Duration.ofMinutes(30);
    
    private Health health = new Health();
    
    @Data
    public static class Health {
        
        private Duration interval = Duration.ofSeconds(1);
        
        private int maxAttempts = 60;
        
        /**
         * 无 HEALTHCHECK 时，连续运行多少次即视为就绪
         */
        private int runningThreshold = 30;
        
        /**
         * 从第几次开始匹配启动日志
         */
        private int logCheckFrom = 15;
        
        private int logCheckEvery = 5;
        
        private int logTailLines = 20;
        
        private int failureTailLines = 50;
    }
}
