package org.vellaric.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * 部署请求（推送事件或手动触发），创建后不可变
 */
@Value
@Builder
@Jacksonized
public class DeploymentRequest {
    
    String projectName;
    
    String repoUrl;
    
    String branch;
    
    String commit;
    
    String commitMessage;
    
    String author;
    
    @Builder.Default
    LocalDateTime requestedAt = LocalDateTime.now();
    
    /**
     * 同一 (项目, 分支) 的部署共享容器名，用此键判断是否冲突
     */
    public String pairKey() {
        return DeploymentKeys.pairKey(projectName, branch);
    }
}
