package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.vellaric.exception.DeploymentException;
import org.vellaric.provider.ContainerRuntime;

/**
 * 下线部署与清理镜像
 */
@Slf4j
@Service
public class CleanupService {
    
    private final DeploymentQueueService deploymentQueueService;
    
    private final ContainerRuntime containerRuntime;
    
    private final NetworkProvisionService networkProvisionService;
    
    private final DeploymentNaming naming;
    
    public CleanupService(DeploymentQueueService deploymentQueueService,
                          ContainerRuntime containerRuntime,
                          NetworkProvisionService networkProvisionService,
                          DeploymentNaming naming) {
        this.deploymentQueueService = deploymentQueueService;
        this.containerRuntime = containerRuntime;
        this.networkProvisionService = networkProvisionService;
        this.naming = naming;
    }
    
    /**
     * 删除容器、镜像、站点配置和 DNS 记录。证书保留，重新部署时可直接复用
     *
     * @return 被移除的域名
     */
    public String removeDeployment(String projectName, String branch) {
        if (deploymentQueueService.isActive(projectName, branch)) {
            throw new DeploymentException(DeploymentException.ERROR_CODE_IN_PROGRESS,
                String.format("%s (%s) 有正在排队或构建的部署，请稍后再试", projectName, branch));
        }
        String containerName = naming.containerName(projectName, branch);
        String image = naming.imageTag(projectName, branch);
        String domain = naming.domain(projectName, branch);
        
        log.info("下线部署: {}", containerName);
        containerRuntime.forceRemoveContainer(containerName);
        containerRuntime.removeImage(image);
        networkProvisionService.deprovision(domain);
        log.info("部署已下线: {} ({})", containerName, domain);
        return domain;
    }
    
    /**
     * docker image prune -a -f
     */
    public String cleanupImages() {
        log.info("清理未使用的 Docker 镜像");
        String output = containerRuntime.pruneImages();
        log.info("镜像清理完成");
        return output;
    }
}
