package org.vellaric.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Frame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.vellaric.dto.CommandResult;
import org.vellaric.dto.ContainerSpec;
import org.vellaric.dto.ContainerState;
import org.vellaric.dto.ContainerStats;
import org.vellaric.exception.BuildException;
import org.vellaric.exception.ContainerOperationException;
import org.vellaric.exception.ContainerStartException;
import org.vellaric.service.ProcessRunner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 基于 Docker 的容器引擎实现：
 * 查询、日志、启停和 exec 走 docker-java，build / run / stats / prune 走 docker CLI
 */
@Slf4j
@Component
public class DockerContainerRuntime implements ContainerRuntime {
    
    private static final int STOP_TIMEOUT_SECONDS = 10;
    
    private final DockerClient dockerClient;
    
    private final ProcessRunner processRunner;
    
    private final ObjectMapper objectMapper;
    
    public DockerContainerRuntime(DockerClient dockerClient, ProcessRunner processRunner, ObjectMapper objectMapper) {
        this.dockerClient = dockerClient;
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public boolean containerExists(String name) {
        return inspect(name).isExists();
    }
    
    @Override
    public void forceRemoveContainer(String name) {
        try {
            dockerClient.stopContainerCmd(name).withTimeout(STOP_TIMEOUT_SECONDS).exec();
            log.info("已停止容器: {}", name);
        } catch (NotFoundException e) {
            log.debug("容器不存在，跳过删除: {}", name);
            return;
        } catch (NotModifiedException e) {
            log.debug("容器已处于停止状态: {}", name);
        }
        try {
            dockerClient.removeContainerCmd(name).withForce(true).exec();
            log.info("已删除容器: {}", name);
        } catch (NotFoundException e) {
            log.debug("容器已被删除: {}", name);
        }
    }
    
    @Override
    public void removeImage(String image) {
        try {
            dockerClient.removeImageCmd(image).withForce(true).exec();
            log.info("已删除镜像: {}", image);
        } catch (NotFoundException e) {
            log.debug("镜像不存在，跳过删除: {}", image);
        }
    }
    
    @Override
    public void buildImage(Path contextDir, String tag) {
        log.info("构建镜像: {} (上下文: {})", tag, contextDir);
        CommandResult result = processRunner.run(
            Arrays.asList("docker", "build", "--no-cache", "-t", tag, "."),
            contextDir, "Docker", 60, TimeUnit.MINUTES);
        if (!result.isSuccess()) {
            throw new BuildException("镜像构建失败，退出码: " + result.getExitCode() + "\n" + result.tail(30));
        }
    }
    
    @Override
    public String runContainer(ContainerSpec spec) {
        List<String> command = new ArrayList<>(Arrays.asList(
            "docker", "run", "-d",
            "--name", spec.getName(),
            "--restart", spec.getRestartPolicy()));
        if (spec.getHostPort() != null) {
            command.add("-p");
            command.add(spec.getHostPort() + ":" + spec.getContainerPort());
        }
        if (spec.getEnvFile() != null) {
            command.add("--env-file");
            command.add(spec.getEnvFile().toString());
        }
        for (Map.Entry<String, String> env : spec.getEnvironment().entrySet()) {
            command.add("-e");
            command.add(env.getKey() + "=" + env.getValue());
        }
        for (Map.Entry<String, String> volume : spec.getVolumes().entrySet()) {
            command.add("-v");
            command.add(volume.getKey() + ":" + volume.getValue());
        }
        command.add(spec.getImage());
        
        log.info("启动容器: name={}, image={}, port={}", spec.getName(), spec.getImage(), spec.getHostPort());
        CommandResult result = processRunner.run(command, null, "Docker", 5, TimeUnit.MINUTES);
        if (!result.isSuccess()) {
            throw new ContainerStartException("启动容器失败: " + spec.getName() + "\n" + result.tail(20));
        }
        String[] lines = result.getOutput().split("\n");
        String containerId = lines[lines.length - 1].trim();
        log.info("容器已启动: {} ({})", spec.getName(), containerId.length() > 12 ? containerId.substring(0, 12) : containerId);
        return containerId;
    }
    
    @Override
    public ContainerState inspect(String name) {
        InspectContainerResponse response;
        try {
            response = dockerClient.inspectContainerCmd(name).exec();
        } catch (NotFoundException e) {
            return ContainerState.missing();
        }
        InspectContainerResponse.ContainerState state = response.getState();
        if (state == null) {
            return new ContainerState(true, false, null, null);
        }
        String health = state.getHealth() != null ? state.getHealth().getStatus() : null;
        return new ContainerState(true, Boolean.TRUE.equals(state.getRunning()), health, parseInstant(state.getStartedAt()));
    }
    
    private Instant parseInstant(String value) {
        if (value == null || value.isEmpty() || value.startsWith("0001-")) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("无法解析容器启动时间: {}", value);
            return null;
        }
    }
    
    @Override
    public String logs(String name, int tail) {
        StringBuilder output = new StringBuilder();
        try {
            dockerClient.logContainerCmd(name)
                .withStdOut(true)
                .withStdErr(true)
                .withTail(tail)
                .exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        if (frame != null && frame.getPayload() != null) {
                            output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }
                })
                .awaitCompletion(10, TimeUnit.SECONDS);
        } catch (NotFoundException e) {
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerOperationException("读取容器日志被中断: " + name, e);
        }
        return output.toString().trim();
    }
    
    @Override
    public void startContainer(String name) {
        try {
            dockerClient.startContainerCmd(name).exec();
            log.info("已启动容器: {}", name);
        } catch (NotModifiedException e) {
            log.info("容器已在运行: {}", name);
        } catch (NotFoundException e) {
            throw new ContainerOperationException("容器不存在: " + name, e);
        }
    }
    
    @Override
    public void stopContainer(String name) {
        try {
            dockerClient.stopContainerCmd(name).withTimeout(STOP_TIMEOUT_SECONDS).exec();
            log.info("已停止容器: {}", name);
        } catch (NotModifiedException e) {
            log.info("容器已停止: {}", name);
        } catch (NotFoundException e) {
            throw new ContainerOperationException("容器不存在: " + name, e);
        }
    }
    
    @Override
    public void restartContainer(String name) {
        try {
            dockerClient.restartContainerCmd(name).exec();
            log.info("已重启容器: {}", name);
        } catch (NotFoundException e) {
            throw new ContainerOperationException("容器不存在: " + name, e);
        }
    }
    
    @Override
    public CommandResult exec(String name, String... command) {
        StringBuilder output = new StringBuilder();
        try {
            ExecCreateCmdResponse exec = dockerClient.execCreateCmd(name)
                .withAttachStdout(true)
                .withAttachStderr(true)
                .withCmd(command)
                .exec();
            
            dockerClient.execStartCmd(exec.getId())
                .exec(new ResultCallback.Adapter<Frame>() {
                    @Override
                    public void onNext(Frame frame) {
                        if (frame != null && frame.getPayload() != null) {
                            output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }
                })
                .awaitCompletion(30, TimeUnit.SECONDS);
            
            Long exitCode = dockerClient.inspectExecCmd(exec.getId()).exec().getExitCodeLong();
            return new CommandResult(exitCode == null ? -1 : exitCode.intValue(), output.toString().trim());
        } catch (NotFoundException e) {
            throw new ContainerOperationException("容器不存在: " + name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContainerOperationException("容器内命令执行被中断: " + name, e);
        }
    }
    
    @Override
    public ContainerStats stats(String name) {
        CommandResult result = processRunner.run(
            Arrays.asList("docker", "stats", name, "--no-stream", "--format", "{{json .}}"),
            null, "Docker", 1, TimeUnit.MINUTES);
        if (!result.isSuccess() || result.getOutput().isEmpty()) {
            throw new ContainerOperationException("获取容器资源占用失败: " + name);
        }
        try {
            JsonNode node = objectMapper.readTree(result.getOutput().split("\n")[0]);
            return new ContainerStats(node.path("CPUPerc").asText("N/A"), node.path("MemUsage").asText("N/A"));
        } catch (IOException e) {
            throw new ContainerOperationException("解析 docker stats 输出失败: " + name, e);
        }
    }
    
    @Override
    public String pruneImages() {
        CommandResult result = processRunner.run("docker", "image", "prune", "-a", "-f");
        if (!result.isSuccess()) {
            throw new ContainerOperationException("清理镜像失败: " + result.tail(10));
        }
        return result.getOutput();
    }
}
