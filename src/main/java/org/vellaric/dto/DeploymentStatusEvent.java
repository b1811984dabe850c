package org.vellaric.dto;

import lombok.Builder;
import lombok.Data;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DeploymentStatus;

import java.time.LocalDateTime;

/**
 * 部署状态变更事件
 */
@Data
@Builder
public class DeploymentStatusEvent {
    
    private String id;
    
    private String projectName;
    
    private String branch;
    
    private DeploymentStatus status;
    
    private String domain;
    
    private Integer port;
    
    private CertificateState certificateState;
    
    private String error;
    
    private LocalDateTime timestamp;
    
    /**
     * 事件发生时的完整记录快照
     */
    private DeploymentInfo deployment;
}
