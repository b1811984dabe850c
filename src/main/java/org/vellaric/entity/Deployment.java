package org.vellaric.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DeploymentStatus;

import java.time.LocalDateTime;

/**
 * 部署历史
 */
@Data
@TableName("deployment")
public class Deployment {
    
    @TableId(type = IdType.INPUT)
    private String id;
    
    private String projectName;
    
    private String branch;
    
    private String commitId;
    
    private String commitMessage;
    
    private String author;
    
    private String repoUrl;
    
    private DeploymentStatus status;
    
    private Integer port;
    
    private String containerName;
    
    private String domain;
    
    private CertificateState certificateState;
    
    private String certificateError;
    
    private String errorMessage;
    
    private LocalDateTime queuedAt;
    
    private LocalDateTime startedAt;
    
    private LocalDateTime deployedAt;
    
    private LocalDateTime failedAt;
    
    private LocalDateTime updatedAt;
}
