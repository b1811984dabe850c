package org.vellaric.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vellaric.config.DeployProperties;
import org.vellaric.config.GitProperties;
import org.vellaric.config.NetworkProperties;
import org.vellaric.config.PortProperties;
import org.vellaric.dto.ContainerInstance;
import org.vellaric.dto.ContainerSpec;
import org.vellaric.dto.ContainerState;
import org.vellaric.dto.DeploymentRequest;
import org.vellaric.exception.BuildException;
import org.vellaric.exception.ContainerExitedException;
import org.vellaric.exception.DeploymentCancelledException;
import org.vellaric.exception.HealthTimeoutException;
import org.vellaric.provider.FakeContainerRuntime;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ContainerLifecycleServiceTest {

    @TempDir
    Path workspace;

    private FakeContainerRuntime runtime;

    private PortManagerService portManager;

    private EnvVariableService envVariableService;

    private ContainerLifecycleService lifecycle;

    private final DeploymentRequest request = DeploymentRequest.builder()
        .projectName("api")
        .branch("dev")
        .commit("abc123")
        .repoUrl("https://github.com/acme/api.git")
        .build();

    @BeforeEach
    void setUp() throws Exception {
        Files.write(workspace.resolve("Dockerfile"), Arrays.asList("FROM node:20", "EXPOSE 8080"), StandardCharsets.UTF_8);
        Files.write(workspace.resolve(".env"), Collections.singletonList("NODE_ENV=development"), StandardCharsets.UTF_8);

        DeployProperties deployProperties = new DeployProperties();
        deployProperties.getHealth().setInterval(Duration.ofMillis(1));
        deployProperties.getHealth().setMaxAttempts(5);
        deployProperties.getHealth().setRunningThreshold(2);

        PortProperties portProperties = new PortProperties();
        portProperties.setAppMin(45000);
        portProperties.setAppMax(45999);
        portManager = new PortManagerService(portProperties);

        FileManagerService fileManager = new FileManagerService(deployProperties, new GitProperties(), mock(ProcessRunner.class)) {
            @Override
            public Path materializeSource(DeploymentRequest deploymentRequest) {
                return workspace;
            }
        };

        envVariableService = mock(EnvVariableService.class);
        when(envVariableService.getVariables("api", "dev"))
            .thenReturn(Collections.singletonMap("NODE_ENV", "production"));

        NetworkProperties networkProperties = new NetworkProperties();
        networkProperties.getDomain().setBaseDomain("example.com");

        runtime = new FakeContainerRuntime();
        lifecycle = new ContainerLifecycleService(fileManager, runtime, portManager, new EnvironmentResolver(),
            envVariableService, new HealthPoller(), new DeploymentNaming(networkProperties), deployProperties,
            new DeploymentLogService(deployProperties));
    }

    @Test
    @DisplayName("old container and image are removed before building and running")
    void deploysInOrder() {
        ContainerInstance instance = lifecycle.deployContainer("d1", request, "api-dev.example.com", CancellationToken.none());

        assertEquals(Arrays.asList("rm api-dev", "rmi api:dev", "build api:dev", "run api-dev"), runtime.getOperations());
        assertEquals("api-dev", instance.getContainerName());
        assertEquals(8080, instance.getInternalPort());
        assertTrue(instance.getHostPort() >= 45000 && instance.getHostPort() <= 45999);
        assertTrue(instance.getEnvironmentKeys().contains(EnvironmentResolver.DEPLOY_DOMAIN));
        assertTrue(portManager.getReservedPorts().isEmpty());
    }

    @Test
    @DisplayName("the env file passed to docker run is resolved and removed afterwards")
    void envFileIsResolvedAndDeleted() {
        lifecycle.deployContainer("d1", request, "api-dev.example.com", CancellationToken.none());

        ContainerSpec spec = runtime.getRunSpecs().get(0);
        Path envFile = spec.getEnvFile();
        assertNotNull(envFile);
        assertFalse(Files.exists(envFile));
        assertEquals(Integer.valueOf(8080), spec.getContainerPort());
    }

    @Test
    @DisplayName("redeploying the same branch replaces the running container")
    void redeployReplacesContainer() {
        lifecycle.deployContainer("d1", request, "api-dev.example.com", CancellationToken.none());
        lifecycle.deployContainer("d2", request, "api-dev.example.com", CancellationToken.none());

        assertEquals(1, runtime.containerCount());
        assertEquals(2, runtime.getRunSpecs().size());
    }

    @Test
    @DisplayName("a container that exits fails on the first check with its logs")
    void exitedContainerFailsFast() {
        runtime.setStateAfterRun(name -> new ContainerState(true, false, null, null));
        runtime.setLogs("Error: Cannot find module 'express'");

        ContainerExitedException e = assertThrows(ContainerExitedException.class,
            () -> lifecycle.deployContainer("d1", request, "api-dev.example.com", CancellationToken.none()));

        assertEquals("Error: Cannot find module 'express'", e.getLastLogs());
        assertTrue(portManager.getReservedPorts().isEmpty());
    }

    @Test
    void unhealthyContainerTimesOut() {
        runtime.setStateAfterRun(name -> new ContainerState(true, true, "unhealthy", Instant.now()));

        HealthTimeoutException e = assertThrows(HealthTimeoutException.class,
            () -> lifecycle.deployContainer("d1", request, "api-dev.example.com", CancellationToken.none()));
        assertFalse(e instanceof ContainerExitedException);
    }

    @Test
    void buildFailureStopsBeforeRun() {
        runtime.failBuild("npm ERR! missing script: build");

        assertThrows(BuildException.class,
            () -> lifecycle.deployContainer("d1", request, "api-dev.example.com", CancellationToken.none()));
        assertTrue(runtime.getRunSpecs().isEmpty());
    }

    @Test
    void cancelledTokenStopsBeforeAnyWork() {
        CancellationToken token = new CancellationToken();
        token.cancel("新的部署请求已到达");

        DeploymentCancelledException e = assertThrows(DeploymentCancelledException.class,
            () -> lifecycle.deployContainer("d1", request, "api-dev.example.com", token));

        assertEquals("新的部署请求已到达", e.getMessage());
        assertTrue(runtime.getOperations().isEmpty());
    }

    @Test
    @DisplayName("persisted variables reach the container over repository defaults")
    void persistedVariablesWin() throws Exception {
        final String[] envContent = new String[1];
        FakeContainerRuntime capturing = new FakeContainerRuntime() {
            @Override
            public synchronized String runContainer(ContainerSpec spec) {
                try {
                    envContent[0] = new String(Files.readAllBytes(spec.getEnvFile()), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
                return super.runContainer(spec);
            }
        };
        DeployProperties deployProperties = new DeployProperties();
        deployProperties.getHealth().setInterval(Duration.ofMillis(1));
        deployProperties.getHealth().setRunningThreshold(1);
        NetworkProperties networkProperties = new NetworkProperties();
        FileManagerService fileManager = new FileManagerService(deployProperties, new GitProperties(), mock(ProcessRunner.class)) {
            @Override
            public Path materializeSource(DeploymentRequest deploymentRequest) {
                return workspace;
            }
        };
        ContainerLifecycleService service = new ContainerLifecycleService(fileManager, capturing, portManager,
            new EnvironmentResolver(), envVariableService, new HealthPoller(), new DeploymentNaming(networkProperties),
            deployProperties, new DeploymentLogService(deployProperties));

        service.deployContainer("d1", request, "api-dev.example.com", CancellationToken.none());

        Map<String, String> env = FileManagerService.parseEnvLines(Arrays.asList(envContent[0].split("\n")));
        assertEquals("production", env.get("NODE_ENV"));
        assertEquals("dev", env.get(EnvironmentResolver.DEPLOY_BRANCH));
        assertEquals("abc123", env.get(EnvironmentResolver.DEPLOY_COMMIT));
        assertEquals("api-dev.example.com", env.get(EnvironmentResolver.DEPLOY_DOMAIN));
    }
}
