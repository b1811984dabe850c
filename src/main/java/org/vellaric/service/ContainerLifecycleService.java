package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.vellaric.config.DeployProperties;
import org.vellaric.dto.ContainerInstance;
import org.vellaric.dto.ContainerSpec;
import org.vellaric.dto.ContainerState;
import org.vellaric.dto.DeploymentRequest;
import org.vellaric.dto.PollOutcome;
import org.vellaric.dto.PollPolicy;
import org.vellaric.dto.ProbeResult;
import org.vellaric.exception.ContainerExitedException;
import org.vellaric.exception.DeploymentCancelledException;
import org.vellaric.exception.HealthTimeoutException;
import org.vellaric.provider.ContainerRuntime;

import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 容器生命周期：拉取源码、构建镜像、替换容器并等待就绪
 */
@Slf4j
@Service
public class ContainerLifecycleService {
    
    static final Pattern READY_LOG_PATTERN =
        Pattern.compile("server running|listening|started|ready", Pattern.CASE_INSENSITIVE);
    
    private final FileManagerService fileManagerService;
    
    private final ContainerRuntime containerRuntime;
    
    private final PortManagerService portManagerService;
    
    private final EnvironmentResolver environmentResolver;
    
    private final EnvVariableService envVariableService;
    
    private final HealthPoller healthPoller;
    
    private final DeploymentNaming naming;
    
    private final DeployProperties deployProperties;
    
    private final DeploymentLogService deploymentLogService;
    
    public ContainerLifecycleService(FileManagerService fileManagerService,
                                     ContainerRuntime containerRuntime,
                                     PortManagerService portManagerService,
                                     EnvironmentResolver environmentResolver,
                                     EnvVariableService envVariableService,
                                     HealthPoller healthPoller,
                                     DeploymentNaming naming,
                                     DeployProperties deployProperties,
                                     DeploymentLogService deploymentLogService) {
        this.fileManagerService = fileManagerService;
        this.containerRuntime = containerRuntime;
        this.portManagerService = portManagerService;
        this.environmentResolver = environmentResolver;
        this.envVariableService = envVariableService;
        this.healthPoller = healthPoller;
        this.naming = naming;
        this.deployProperties = deployProperties;
        this.deploymentLogService = deploymentLogService;
    }
    
    /**
     * 部署容器。同名旧容器和旧镜像会先被删除（替换式部署）
     *
     * @param deploymentId 部署 ID，用于步骤日志
     * @param domain       注入为 DEPLOY_DOMAIN 的公网域名
     */
    public ContainerInstance deployContainer(String deploymentId,
                                             DeploymentRequest request,
                                             String domain,
                                             CancellationToken token) {
        String projectName = request.getProjectName();
        String branch = request.getBranch();
        String containerName = naming.containerName(projectName, branch);
        String image = naming.imageTag(projectName, branch);
        
        // 1. 源码
        token.throwIfCancelled();
        step(deploymentId, "拉取源码: " + projectName + " (" + branch + ")");
        Path workspace = fileManagerService.materializeSource(request);
        
        // 2-3. Dockerfile 与容器端口
        Path dockerfile = fileManagerService.requireBuildFile(workspace);
        int internalPort = fileManagerService.detectExposedPort(dockerfile);
        step(deploymentId, "容器端口: " + internalPort);
        
        // 4. 删除旧容器和旧镜像
        token.throwIfCancelled();
        step(deploymentId, "删除旧容器和镜像: " + containerName);
        containerRuntime.forceRemoveContainer(containerName);
        containerRuntime.removeImage(image);
        
        // 5. 构建
        step(deploymentId, "构建镜像: " + image);
        containerRuntime.buildImage(workspace, image);
        
        // 6. 分配端口
        token.throwIfCancelled();
        int hostPort = portManagerService.allocateAppPort();
        step(deploymentId, "分配端口: " + hostPort);
        
        // 7-9. 环境变量与启动
        String containerId;
        Map<String, String> env;
        Path envFile = null;
        try {
            env = environmentResolver.resolve(
                fileManagerService.readEnvDefaults(workspace),
                envVariableService.getVariables(projectName, branch),
                branch, request.getCommit(), domain);
            log.info("容器 {} 环境变量: {}", containerName, EnvironmentResolver.masked(env));
            envFile = fileManagerService.writeEnvFile(containerName, env);
            
            step(deploymentId, "启动容器: " + containerName + " -> " + hostPort + ":" + internalPort);
            containerId = containerRuntime.runContainer(ContainerSpec.builder()
                .name(containerName)
                .image(image)
                .hostPort(hostPort)
                .containerPort(internalPort)
                .envFile(envFile)
                .build());
        } finally {
            fileManagerService.deleteQuietly(envFile);
            portManagerService.release(hostPort);
        }
        
        // 10. 等待就绪
        step(deploymentId, "等待容器就绪: " + containerName);
        waitForContainer(containerName, token);
        step(deploymentId, "容器已就绪: " + containerName);
        
        return ContainerInstance.builder()
            .containerName(containerName)
            .containerId(containerId)
            .image(image)
            .hostPort(hostPort)
            .internalPort(internalPort)
            .environmentKeys(env.keySet())
            .build();
    }
    
    /**
     * 有 HEALTHCHECK 时只认 healthy；否则连续运行达到阈值、或日志出现启动标志即视为就绪。
     * 容器停止立即失败
     */
    void waitForContainer(String containerName, CancellationToken token) {
        DeployProperties.Health health = deployProperties.getHealth();
        PollPolicy policy = PollPolicy.of(health.getInterval(), health.getMaxAttempts());
        
        PollOutcome outcome = healthPoller.poll("容器 " + containerName, policy, attempt -> {
            ContainerState state = containerRuntime.inspect(containerName);
            if (!state.isExists() || !state.isRunning()) {
                return ProbeResult.dead(containerRuntime.logs(containerName, health.getFailureTailLines()));
            }
            if (state.hasHealthCheck()) {
                return "healthy".equals(state.getHealthStatus())
                    ? ProbeResult.ready("healthy")
                    : ProbeResult.waiting("health: " + state.getHealthStatus());
            }
            if (attempt >= health.getRunningThreshold()) {
                return ProbeResult.ready("持续运行 " + attempt + " 次检查");
            }
            if (attempt >= health.getLogCheckFrom() && attempt % health.getLogCheckEvery() == 0) {
                String recent = containerRuntime.logs(containerName, health.getLogTailLines());
                if (READY_LOG_PATTERN.matcher(recent).find()) {
                    return ProbeResult.ready("日志显示服务已启动");
                }
            }
            return ProbeResult.waiting();
        }, token);
        
        switch (outcome.getResult()) {
            case READY:
                return;
            case DEAD:
                throw new ContainerExitedException(containerName, outcome.getDetail());
            case CANCELLED:
                throw new DeploymentCancelledException(outcome.getDetail() != null ? outcome.getDetail() : "部署已取消");
            default:
                throw new HealthTimeoutException(String.format("容器 %s 在 %d 次检查后仍未就绪",
                    containerName, outcome.getAttempts()));
        }
    }
    
    private void step(String deploymentId, String message) {
        log.info("[{}] {}", deploymentId, message);
        deploymentLogService.info(deploymentId, message);
    }
}
