package org.vellaric.service;

import org.vellaric.dto.DeploymentStatusEvent;

/**
 * 部署状态变更监听器
 */
public interface DeploymentStatusListener {
    
    void onStatusChange(DeploymentStatusEvent event);
}
