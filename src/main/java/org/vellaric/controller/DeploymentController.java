package org.vellaric.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.vellaric.config.GitProperties;
import org.vellaric.dto.ApiResponse;
import org.vellaric.dto.DeploymentInfo;
import org.vellaric.dto.DeploymentLogEntry;
import org.vellaric.dto.DeploymentRequest;
import org.vellaric.dto.DomainBinding;
import org.vellaric.dto.QueueStatus;
import org.vellaric.entity.Deployment;
import org.vellaric.exception.DeploymentNotFoundException;
import org.vellaric.service.CleanupService;
import org.vellaric.service.DeploymentCertificateService;
import org.vellaric.service.DeploymentHistoryService;
import org.vellaric.service.DeploymentLogService;
import org.vellaric.service.DeploymentQueueService;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 部署管理 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class DeploymentController {
    
    @Autowired
    private DeploymentQueueService deploymentQueueService;
    
    @Autowired
    private DeploymentHistoryService deploymentHistoryService;
    
    @Autowired
    private DeploymentLogService deploymentLogService;
    
    @Autowired
    private CleanupService cleanupService;
    
    @Autowired
    private DeploymentCertificateService deploymentCertificateService;
    
    @Autowired
    private GitProperties gitProperties;
    
    /**
     * 提交部署（推送事件或手动触发）
     * POST /api/deployments
     */
    @PostMapping("/deployments")
    public ResponseEntity<ApiResponse<Map<String, String>>> enqueue(@RequestBody DeploymentRequest request) {
        log.info("部署请求: project={}, branch={}, commit={}",
            request.getProjectName(), request.getBranch(), request.getCommit());
        String id = deploymentQueueService.enqueue(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.success(Collections.singletonMap("id", id), "部署已加入队列"));
    }
    
    /**
     * 队列状态
     * GET /api/queue
     */
    @GetMapping("/queue")
    public ResponseEntity<ApiResponse<QueueStatus>> queueStatus() {
        return ResponseEntity.ok(ApiResponse.success(deploymentQueueService.status()));
    }
    
    /**
     * 部署详情：优先取内存中的记录，否则查历史
     * GET /api/deployments/{id}
     */
    @GetMapping("/deployments/{id}")
    public ResponseEntity<ApiResponse<DeploymentInfo>> getDeployment(@PathVariable String id) {
        DeploymentInfo info = deploymentQueueService.getRecord(id);
        if (info == null) {
            Deployment deployment = deploymentHistoryService.getDeployment(id);
            if (deployment == null) {
                throw new DeploymentNotFoundException(id);
            }
            info = DeploymentHistoryService.toInfo(deployment);
        }
        return ResponseEntity.ok(ApiResponse.success(info));
    }
    
    /**
     * 部署历史
     * GET /api/deployments?limit=20
     */
    @GetMapping("/deployments")
    public ResponseEntity<ApiResponse<List<DeploymentInfo>>> listDeployments(
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(ApiResponse.success(deploymentHistoryService.listRecent(limit)));
    }
    
    /**
     * 部署步骤日志
     * GET /api/deployments/{id}/logs
     */
    @GetMapping("/deployments/{id}/logs")
    public ResponseEntity<ApiResponse<List<DeploymentLogEntry>>> getLogs(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(deploymentLogService.getLogs(id)));
    }
    
    /**
     * 下线部署
     * DELETE /api/deployments/{projectName}/{branch}
     */
    @DeleteMapping("/deployments/{projectName}/{branch}")
    public ResponseEntity<ApiResponse<Map<String, String>>> removeDeployment(@PathVariable String projectName,
                                                                             @PathVariable String branch) {
        log.info("下线部署: project={}, branch={}", projectName, branch);
        String domain = cleanupService.removeDeployment(projectName, branch);
        return ResponseEntity.ok(ApiResponse.success(Collections.singletonMap("domain", domain), "部署已下线"));
    }
    
    /**
     * 下线默认分支的部署
     * DELETE /api/deployments/{projectName}
     */
    @DeleteMapping("/deployments/{projectName}")
    public ResponseEntity<ApiResponse<Map<String, String>>> removeDefaultBranch(@PathVariable String projectName) {
        return removeDeployment(projectName, gitProperties.getDefaultBranch());
    }
    
    /**
     * 重新申请证书
     * POST /api/deployments/{projectName}/{branch}/certificate
     */
    @PostMapping("/deployments/{projectName}/{branch}/certificate")
    public ResponseEntity<ApiResponse<DomainBinding>> reissueCertificate(@PathVariable String projectName,
                                                                         @PathVariable String branch) {
        log.info("重新申请证书: project={}, branch={}", projectName, branch);
        DomainBinding binding = deploymentCertificateService.reissueCertificate(projectName, branch);
        String message = binding.isHttps() ? "证书已签发" : "证书申请失败: " + binding.getCertificateError();
        return ResponseEntity.ok(ApiResponse.success(binding, message));
    }
    
    /**
     * 续期证书
     * POST /api/deployments/{projectName}/{branch}/certificate/renew
     */
    @PostMapping("/deployments/{projectName}/{branch}/certificate/renew")
    public ResponseEntity<ApiResponse<Map<String, String>>> renewCertificate(@PathVariable String projectName,
                                                                             @PathVariable String branch) {
        String domain = deploymentCertificateService.renewCertificate(projectName, branch);
        return ResponseEntity.ok(ApiResponse.success(Collections.singletonMap("domain", domain), "证书已续期"));
    }
    
    /**
     * 清理未使用的镜像
     * POST /api/cleanup
     */
    @PostMapping("/cleanup")
    public ResponseEntity<ApiResponse<String>> cleanupImages() {
        return ResponseEntity.ok(ApiResponse.success(cleanupService.cleanupImages(), "镜像清理完成"));
    }
}
