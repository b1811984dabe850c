package org.vellaric.provider;

import org.vellaric.dto.CommandResult;
import org.vellaric.dto.ContainerSpec;
import org.vellaric.dto.ContainerState;
import org.vellaric.dto.ContainerStats;
import org.vellaric.exception.BuildException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 内存中的容器引擎，记录调用顺序供断言
 */
public class FakeContainerRuntime implements ContainerRuntime {

    private final Map<String, ContainerSpec> containers = new LinkedHashMap<>();

    private final Map<String, ContainerState> states = new LinkedHashMap<>();

    private final List<String> images = new ArrayList<>();

    private final List<String> operations = Collections.synchronizedList(new ArrayList<>());

    private final List<ContainerSpec> runSpecs = new ArrayList<>();

    private final AtomicInteger idSequence = new AtomicInteger();

    private String logs = "";

    private String buildFailure;

    private Function<String, ContainerState> stateAfterRun = name ->
        new ContainerState(true, true, null, Instant.now());

    private Function<String[], CommandResult> execHandler = command -> new CommandResult(0, "");

    public synchronized void setLogs(String logs) {
        this.logs = logs;
    }

    public synchronized void failBuild(String output) {
        this.buildFailure = output;
    }

    public synchronized void setStateAfterRun(Function<String, ContainerState> stateAfterRun) {
        this.stateAfterRun = stateAfterRun;
    }

    public synchronized void setExecHandler(Function<String[], CommandResult> execHandler) {
        this.execHandler = execHandler;
    }

    public synchronized void setState(String name, ContainerState state) {
        states.put(name, state);
    }

    public List<String> getOperations() {
        synchronized (operations) {
            return new ArrayList<>(operations);
        }
    }

    public synchronized List<ContainerSpec> getRunSpecs() {
        return new ArrayList<>(runSpecs);
    }

    public synchronized List<String> getImages() {
        return new ArrayList<>(images);
    }

    public synchronized int containerCount() {
        return containers.size();
    }

    @Override
    public synchronized boolean containerExists(String name) {
        return containers.containsKey(name);
    }

    @Override
    public synchronized void forceRemoveContainer(String name) {
        operations.add("rm " + name);
        containers.remove(name);
        states.remove(name);
    }

    @Override
    public synchronized void removeImage(String image) {
        operations.add("rmi " + image);
        images.remove(image);
    }

    @Override
    public synchronized void buildImage(Path contextDir, String tag) {
        operations.add("build " + tag);
        if (buildFailure != null) {
            throw new BuildException("镜像构建失败: " + buildFailure);
        }
        images.add(tag);
    }

    @Override
    public synchronized String runContainer(ContainerSpec spec) {
        if (containers.containsKey(spec.getName())) {
            throw new IllegalStateException("container name already in use: " + spec.getName());
        }
        if (spec.getEnvFile() != null && !Files.exists(spec.getEnvFile())) {
            throw new IllegalStateException("env file missing: " + spec.getEnvFile());
        }
        operations.add("run " + spec.getName());
        containers.put(spec.getName(), spec);
        runSpecs.add(spec);
        states.put(spec.getName(), stateAfterRun.apply(spec.getName()));
        return "container-" + idSequence.incrementAndGet();
    }

    @Override
    public synchronized ContainerState inspect(String name) {
        ContainerState state = states.get(name);
        return state != null ? state : ContainerState.missing();
    }

    @Override
    public synchronized String logs(String name, int tail) {
        return logs;
    }

    @Override
    public synchronized void startContainer(String name) {
        operations.add("start " + name);
        states.put(name, new ContainerState(true, true, null, Instant.now()));
    }

    @Override
    public synchronized void stopContainer(String name) {
        operations.add("stop " + name);
        states.put(name, new ContainerState(true, false, null, null));
    }

    @Override
    public synchronized void restartContainer(String name) {
        operations.add("restart " + name);
        states.put(name, new ContainerState(true, true, null, Instant.now()));
    }

    @Override
    public synchronized CommandResult exec(String name, String... command) {
        operations.add("exec " + name + " " + String.join(" ", command));
        return execHandler.apply(command);
    }

    @Override
    public synchronized ContainerStats stats(String name) {
        return new ContainerStats("0.50%", "20MiB / 1GiB");
    }

    @Override
    public synchronized String pruneImages() {
        operations.add("prune");
        images.clear();
        return "Total reclaimed space: 0B";
    }
}
