package org.vellaric.dto;

import lombok.Data;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DeploymentStatus;
import org.vellaric.service.CancellationToken;

import java.time.LocalDateTime;

/**
 * 部署在队列中的可变状态，只由 DeploymentQueueService 修改
 */
@Data
public class DeploymentRecord {
    
    private final String id;
    
    private final DeploymentRequest request;
    
    private final CancellationToken cancellationToken = new CancellationToken();
    
    private DeploymentStatus status = DeploymentStatus.QUEUED;
    
    private Integer port;
    
    private String containerName;
    
    private String containerId;
    
    private String domain;
    
    private CertificateState certificateState = CertificateState.NONE;
    
    private String certificateError;
    
    private String error;
    
    private LocalDateTime queuedAt;
    
    private LocalDateTime startedAt;
    
    private LocalDateTime deployedAt;
    
    private LocalDateTime failedAt;
    
    public String pairKey() {
        return request.pairKey();
    }
    
    public DeploymentInfo toInfo() {
        DeploymentInfo info = new DeploymentInfo();
        info.setId(id);
        info.setProjectName(request.getProjectName());
        info.setBranch(request.getBranch());
        info.setCommit(request.getCommit());
        info.setCommitMessage(request.getCommitMessage());
        info.setRepoUrl(request.getRepoUrl());
        info.setAuthor(request.getAuthor());
        info.setStatus(status);
        info.setPort(port);
        info.setContainerName(containerName);
        info.setDomain(domain);
        info.setCertificateState(certificateState);
        info.setCertificateError(certificateError);
        info.setError(error);
        info.setQueuedAt(queuedAt);
        info.setStartedAt(startedAt);
        info.setDeployedAt(deployedAt);
        info.setFailedAt(failedAt);
        return info;
    }
}
