package org.vellaric.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 容器运行状态（docker inspect）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContainerState {
    
    private boolean exists;
    
    private boolean running;
    
    /**
     * healthy / unhealthy / starting，未配置 HEALTHCHECK 时为 null
     */
    private String healthStatus;
    
    private Instant startedAt;
    
    public static ContainerState missing() {
        return new ContainerState(false, false, null, null);
    }
    
    public boolean hasHealthCheck() {
        return healthStatus != null && !healthStatus.isEmpty();
    }
}
