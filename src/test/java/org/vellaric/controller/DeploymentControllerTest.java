package org.vellaric.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.vellaric.config.GitProperties;
import org.vellaric.dto.DeploymentInfo;
import org.vellaric.dto.DeploymentRequest;
import org.vellaric.dto.DomainBinding;
import org.vellaric.dto.QueueStatus;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DeploymentStatus;
import org.vellaric.entity.Deployment;
import org.vellaric.exception.DeploymentException;
import org.vellaric.exception.DeploymentNotFoundException;
import org.vellaric.exception.InvalidRequestException;
import org.vellaric.service.CleanupService;
import org.vellaric.service.DeploymentCertificateService;
import org.vellaric.service.DeploymentHistoryService;
import org.vellaric.service.DeploymentLogService;
import org.vellaric.service.DeploymentQueueService;

import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DeploymentControllerTest {

    @Mock
    private DeploymentQueueService deploymentQueueService;

    @Mock
    private DeploymentHistoryService deploymentHistoryService;

    @Mock
    private DeploymentLogService deploymentLogService;

    @Mock
    private CleanupService cleanupService;

    @Mock
    private DeploymentCertificateService deploymentCertificateService;

    @Mock
    private GitProperties gitProperties;

    @InjectMocks
    private DeploymentController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("POST /api/deployments enqueues and returns the id")
    void enqueue() throws Exception {
        when(deploymentQueueService.enqueue(any(DeploymentRequest.class))).thenReturn("deploy_1_abc");

        mockMvc.perform(post("/api/deployments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectName\":\"api\",\"repoUrl\":\"https://github.com/acme/api.git\",\"branch\":\"main\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.id").value("deploy_1_abc"));
    }

    @Test
    void enqueueWithMissingFieldsIsBadRequest() throws Exception {
        when(deploymentQueueService.enqueue(any(DeploymentRequest.class)))
            .thenThrow(new InvalidRequestException("缺少必填字段: projectName, repoUrl, branch"));

        mockMvc.perform(post("/api/deployments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectName\":\"api\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value(InvalidRequestException.ERROR_CODE));
    }

    @Test
    void queueStatus() throws Exception {
        QueueStatus queueStatus = new QueueStatus();
        queueStatus.setPending(Collections.emptyList());
        queueStatus.setBuilding(Collections.emptyList());
        queueStatus.setCapacity(3);
        when(deploymentQueueService.status()).thenReturn(queueStatus);

        mockMvc.perform(get("/api/queue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.capacity").value(3))
            .andExpect(jsonPath("$.data.activeCount").value(0));
    }

    @Test
    @DisplayName("a record evicted from memory is served from history")
    void deploymentFromHistory() throws Exception {
        Deployment deployment = new Deployment();
        deployment.setId("deploy_1_abc");
        deployment.setStatus(DeploymentStatus.SUCCESS);
        deployment.setDomain("api.example.com");
        when(deploymentQueueService.getRecord("deploy_1_abc")).thenReturn(null);
        when(deploymentHistoryService.getDeployment("deploy_1_abc")).thenReturn(deployment);

        mockMvc.perform(get("/api/deployments/deploy_1_abc"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("success"))
            .andExpect(jsonPath("$.data.domain").value("api.example.com"));
    }

    @Test
    void liveRecordWins() throws Exception {
        DeploymentInfo info = new DeploymentInfo();
        info.setId("deploy_2");
        info.setStatus(DeploymentStatus.BUILDING);
        when(deploymentQueueService.getRecord("deploy_2")).thenReturn(info);

        mockMvc.perform(get("/api/deployments/deploy_2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("building"));
        verifyNoInteractions(deploymentHistoryService);
    }

    @Test
    void unknownDeploymentIsNotFound() throws Exception {
        mockMvc.perform(get("/api/deployments/nope"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value(DeploymentNotFoundException.ERROR_CODE));
    }

    @Test
    void logs() throws Exception {
        when(deploymentLogService.getLogs("deploy_1")).thenReturn(Collections.emptyList());

        mockMvc.perform(get("/api/deployments/deploy_1/logs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    @DisplayName("removing a deployment that is still building is a conflict")
    void removeWhileActiveIsConflict() throws Exception {
        when(cleanupService.removeDeployment("api", "dev")).thenThrow(
            new DeploymentException(DeploymentException.ERROR_CODE_IN_PROGRESS, "api (dev) 有正在排队或构建的部署，请稍后再试"));

        mockMvc.perform(delete("/api/deployments/api/dev"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value(DeploymentException.ERROR_CODE_IN_PROGRESS));
    }

    @Test
    void removeDefaultBranch() throws Exception {
        when(gitProperties.getDefaultBranch()).thenReturn("main");
        when(cleanupService.removeDeployment("api", "main")).thenReturn("api.example.com");

        mockMvc.perform(delete("/api/deployments/api"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.domain").value("api.example.com"));
    }

    @Test
    void reissueCertificate() throws Exception {
        DomainBinding binding = new DomainBinding();
        binding.setDomain("api.example.com");
        binding.setCertificateState(CertificateState.ISSUED);
        when(deploymentCertificateService.reissueCertificate("api", "main")).thenReturn(binding);

        mockMvc.perform(post("/api/deployments/api/main/certificate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.certificateState").value("issued"))
            .andExpect(jsonPath("$.message").value("证书已签发"));
    }

    @Test
    void cleanupImages() throws Exception {
        when(cleanupService.cleanupImages()).thenReturn("Total reclaimed space: 1.2GB");

        mockMvc.perform(post("/api/cleanup"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value("Total reclaimed space: 1.2GB"));
    }
}
