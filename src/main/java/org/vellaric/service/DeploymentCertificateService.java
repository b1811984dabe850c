package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.vellaric.dto.DomainBinding;
import org.vellaric.entity.Deployment;
import org.vellaric.exception.DeploymentNotFoundException;

/**
 * 已上线部署的证书补签与续期
 */
@Slf4j
@Service
public class DeploymentCertificateService {
    
    private final DeploymentHistoryService deploymentHistoryService;
    
    private final NetworkProvisionService networkProvisionService;
    
    public DeploymentCertificateService(DeploymentHistoryService deploymentHistoryService,
                                        NetworkProvisionService networkProvisionService) {
        this.deploymentHistoryService = deploymentHistoryService;
        this.networkProvisionService = networkProvisionService;
    }
    
    /**
     * 重新申请证书（DNS 生效后由运维触发），结果写回最近一次成功部署的记录
     */
    public DomainBinding reissueCertificate(String projectName, String branch) {
        Deployment deployment = requireLatest(projectName, branch);
        log.info("重新申请证书: {} ({})", deployment.getDomain(), deployment.getId());
        DomainBinding binding = networkProvisionService.reissueCertificate(
            deployment.getDomain(), deployment.getPort(), deployment.getContainerName());
        deploymentHistoryService.updateCertificate(deployment.getId(), binding);
        return binding;
    }
    
    public String renewCertificate(String projectName, String branch) {
        Deployment deployment = requireLatest(projectName, branch);
        networkProvisionService.renewCertificate(deployment.getDomain());
        return deployment.getDomain();
    }
    
    private Deployment requireLatest(String projectName, String branch) {
        Deployment deployment = deploymentHistoryService.findLatestSuccessful(projectName, branch);
        if (deployment == null) {
            throw new DeploymentNotFoundException(projectName + "/" + branch);
        }
        return deployment;
    }
}
