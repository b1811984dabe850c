package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.vellaric.config.DeployProperties;
import org.vellaric.dto.DeploymentLogEntry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 部署步骤日志（内存），每个部署保留最近若干条，部署结束后保留一段时间
 */
@Slf4j
@Service
public class DeploymentLogService {
    
    public static final String INFO = "info";
    public static final String WARN = "warn";
    public static final String ERROR = "error";
    
    private final DeployProperties deployProperties;
    
    private final Clock clock;
    
    private final Map<String, Deque<DeploymentLogEntry>> logs = new ConcurrentHashMap<>();
    
    private final Map<String, Instant> completedAt = new ConcurrentHashMap<>();
    
    public DeploymentLogService(DeployProperties deployProperties) {
        this(deployProperties, Clock.systemDefaultZone());
    }
    
    DeploymentLogService(DeployProperties deployProperties, Clock clock) {
        this.deployProperties = deployProperties;
        this.clock = clock;
    }
    
    public void info(String deploymentId, String message) {
        append(deploymentId, INFO, message);
    }
    
    public void warn(String deploymentId, String message) {
        append(deploymentId, WARN, message);
    }
    
    public void error(String deploymentId, String message) {
        append(deploymentId, ERROR, message);
    }
    
    public void append(String deploymentId, String level, String message) {
        if (deploymentId == null) {
            return;
        }
        purgeExpired();
        Deque<DeploymentLogEntry> entries = logs.computeIfAbsent(deploymentId, id -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addLast(new DeploymentLogEntry(LocalDateTime.now(clock), level, message));
            while (entries.size() > deployProperties.getLogsPerDeployment()) {
                entries.removeFirst();
            }
        }
    }
    
    public List<DeploymentLogEntry> getLogs(String deploymentId) {
        purgeExpired();
        Deque<DeploymentLogEntry> entries = logs.get(deploymentId);
        if (entries == null) {
            return Collections.emptyList();
        }
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }
    
    /**
     * 部署结束，保留期过后日志被清除
     */
    public void markCompleted(String deploymentId) {
        completedAt.put(deploymentId, clock.instant());
    }
    
    void purgeExpired() {
        Instant cutoff = clock.instant().minus(deployProperties.getRetention());
        completedAt.entrySet().removeIf(entry -> {
            if (entry.getValue().isBefore(cutoff)) {
                logs.remove(entry.getKey());
                log.debug("清除过期部署日志: {}", entry.getKey());
                return true;
            }
            return false;
        });
    }
}
