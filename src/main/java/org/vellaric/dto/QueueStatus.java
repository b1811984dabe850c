package org.vellaric.dto;

import lombok.Data;

import java.util.List;

/**
 * 队列快照
 */
@Data
public class QueueStatus {
    
    private List<DeploymentInfo> pending;
    
    private List<DeploymentInfo> building;
    
    private int queued;
    
    private int activeCount;
    
    private int capacity;
}
