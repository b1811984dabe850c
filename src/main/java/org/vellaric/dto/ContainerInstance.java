package org.vellaric.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * 一次成功部署产生的容器
 */
@Data
@Builder
public class ContainerInstance {
    
    private String containerName;
    
    private String containerId;
    
    private String image;
    
    private Integer hostPort;
    
    private Integer internalPort;
    
    /**
     * 注入的环境变量名（不含值）
     */
    private Set<String> environmentKeys;
}
