package org.vellaric.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.vellaric.dto.DomainBinding;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.entity.Deployment;
import org.vellaric.exception.DeploymentNotFoundException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DeploymentCertificateServiceTest {

    private DeploymentHistoryService history;

    private NetworkProvisionService network;

    private DeploymentCertificateService service;

    @BeforeEach
    void setUp() {
        history = mock(DeploymentHistoryService.class);
        network = mock(NetworkProvisionService.class);
        service = new DeploymentCertificateService(history, network);
    }

    @Test
    void reissueUpdatesTheLatestDeployment() {
        Deployment deployment = new Deployment();
        deployment.setId("deploy_1");
        deployment.setDomain("api.example.com");
        deployment.setPort(3001);
        deployment.setContainerName("api-main");
        when(history.findLatestSuccessful("api", "main")).thenReturn(deployment);
        DomainBinding binding = new DomainBinding();
        binding.setCertificateState(CertificateState.ISSUED);
        when(network.reissueCertificate("api.example.com", 3001, "api-main")).thenReturn(binding);

        assertSame(binding, service.reissueCertificate("api", "main"));
        verify(history).updateCertificate("deploy_1", binding);
    }

    @Test
    void nothingDeployedIsNotFound() {
        assertThrows(DeploymentNotFoundException.class, () -> service.renewCertificate("api", "dev"));
        verifyNoInteractions(network);
    }
}
