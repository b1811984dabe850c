package org.vellaric.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 部署步骤日志
 */
@Data
@AllArgsConstructor
public class DeploymentLogEntry {
    
    private LocalDateTime timestamp;
    
    private String level;
    
    private String message;
}
