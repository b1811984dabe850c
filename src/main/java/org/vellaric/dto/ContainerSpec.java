package org.vellaric.dto;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.nio.file.Path;
import java.util.Map;

/**
 * docker run 参数
 */
@Data
@Builder
public class ContainerSpec {
    
    private String name;
    
    private String image;
    
    private Integer hostPort;
    
    private Integer containerPort;
    
    /**
     * --env-file 路径，可为空
     */
    private Path envFile;
    
    @Singular("env")
    private Map<String, String> environment;
    
    /**
     * 宿主机路径 -> 容器路径
     */
    @Singular
    private Map<String, String> volumes;
    
    @Builder.Default
    private String restartPolicy = "unless-stopped";
}
