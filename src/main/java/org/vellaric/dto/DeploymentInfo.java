package org.vellaric.dto;

import lombok.Data;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DeploymentStatus;

import java.time.LocalDateTime;

/**
 * 部署信息响应
 */
@Data
public class DeploymentInfo {
    
    private String id;
    
    private String projectName;
    
    private String branch;
    
    private String commit;
    
    private String commitMessage;
    
    private String repoUrl;
    
    private String author;
    
    private DeploymentStatus status;
    
    private Integer port;
    
    private String containerName;
    
    private String domain;
    
    private CertificateState certificateState;
    
    private String certificateError;
    
    private String error;
    
    private LocalDateTime queuedAt;
    
    private LocalDateTime startedAt;
    
    private LocalDateTime deployedAt;
    
    private LocalDateTime failedAt;
}
