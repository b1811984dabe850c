package org.vellaric.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.vellaric.config.DatabaseProperties;
import org.vellaric.dao.mapper.ManagedDatabaseMapper;
import org.vellaric.dto.CommandResult;
import org.vellaric.dto.ContainerSpec;
import org.vellaric.dto.ContainerState;
import org.vellaric.dto.ContainerStats;
import org.vellaric.dto.DatabaseCredentials;
import org.vellaric.dto.DatabaseInfo;
import org.vellaric.dto.DatabaseStats;
import org.vellaric.dto.PollOutcome;
import org.vellaric.dto.PollPolicy;
import org.vellaric.dto.ProbeResult;
import org.vellaric.dto.enums.DatabaseStatus;
import org.vellaric.entity.ManagedDatabase;
import org.vellaric.exception.ContainerStartException;
import org.vellaric.exception.DatabaseException;
import org.vellaric.exception.DatabaseNotFoundException;
import org.vellaric.exception.DuplicateDatabaseException;
import org.vellaric.exception.InvalidRequestException;
import org.vellaric.provider.ContainerRuntime;
import org.vellaric.provider.DatabaseEngine;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 托管数据库实例：独立容器、独立端口、独立存储目录
 */
@Slf4j
@Service
public class DatabaseManagerService {
    
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private static final Pattern ENVIRONMENT_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-]*$");
    
    private final ManagedDatabaseMapper managedDatabaseMapper;
    
    private final ContainerRuntime containerRuntime;
    
    private final DatabaseEngine databaseEngine;
    
    private final PortManagerService portManagerService;
    
    private final FileManagerService fileManagerService;
    
    private final HealthPoller healthPoller;
    
    private final DeploymentNaming naming;
    
    private final DatabaseProperties databaseProperties;
    
    /**
     * 正在创建中的容器名，防止同名并发创建
     */
    private final Set<String> creating = ConcurrentHashMap.newKeySet();
    
    public DatabaseManagerService(ManagedDatabaseMapper managedDatabaseMapper,
                                  ContainerRuntime containerRuntime,
                                  DatabaseEngine databaseEngine,
                                  PortManagerService portManagerService,
                                  FileManagerService fileManagerService,
                                  HealthPoller healthPoller,
                                  DeploymentNaming naming,
                                  DatabaseProperties databaseProperties) {
        this.managedDatabaseMapper = managedDatabaseMapper;
        this.containerRuntime = containerRuntime;
        this.databaseEngine = databaseEngine;
        this.portManagerService = portManagerService;
        this.fileManagerService = fileManagerService;
        this.healthPoller = healthPoller;
        this.naming = naming;
        this.databaseProperties = databaseProperties;
    }
    
    /**
     * 创建数据库实例，返回的凭据只出现这一次
     *
     * @throws DuplicateDatabaseException (name, environment) 或规整后的容器名已存在
     */
    public DatabaseCredentials createInstance(String name, String environment) {
        if (!StringUtils.hasText(name)) {
            throw new InvalidRequestException("数据库名称不能为空");
        }
        String env = StringUtils.hasText(environment) ? environment.trim() : databaseProperties.getDefaultEnvironment();
        if (!ENVIRONMENT_PATTERN.matcher(env).matches()) {
            throw new InvalidRequestException("环境名称不合法: " + env);
        }
        
        // 先查重，任何容器操作之前
        if (findByNameAndEnvironment(name, env) != null) {
            throw new DuplicateDatabaseException(name, env);
        }
        String containerName = naming.databaseContainerName(name, env);
        // 不同名称可能规整成同一个容器名（Orders / orders），已登记的容器不能当作遗留容器删除
        if (isRegisteredContainer(containerName)) {
            throw new DuplicateDatabaseException(name, env);
        }
        if (!creating.add(containerName)) {
            throw new DuplicateDatabaseException(name, env);
        }
        
        try {
            return doCreate(name, env, containerName);
        } finally {
            creating.remove(containerName);
        }
    }
    
    private DatabaseCredentials doCreate(String name, String environment, String containerName) {
        String id = generateId();
        String password = generatePassword();
        String username = DeploymentNaming.sanitize(name);
        String database = username;
        String host = naming.databaseHost(containerName);
        Path volumePath = Paths.get(databaseProperties.getDataDir(), containerName);
        String version = databaseProperties.getPostgresVersion();
        
        log.info("创建数据库: {} (引擎: {} {}, 环境: {}, 容器: {})", name, databaseEngine.getEngineType(), version, environment, containerName);
        
        // 未登记的同名容器是上次失败遗留的，连同数据目录一起删除，避免版本不一致
        if (containerRuntime.containerExists(containerName)) {
            log.warn("发现遗留的数据库容器，删除容器和数据目录: {}", containerName);
            containerRuntime.forceRemoveContainer(containerName);
            fileManagerService.deleteDirectory(volumePath);
        }
        
        int port = portManagerService.allocateDatabasePort();
        try {
            fileManagerService.createDirectories(volumePath);
            containerRuntime.runContainer(ContainerSpec.builder()
                .name(containerName)
                .image(databaseEngine.getImage(version))
                .hostPort(port)
                .containerPort(databaseEngine.getContainerPort())
                .environment(databaseEngine.getContainerEnvironment(username, password, database))
                .volume(volumePath.toString(), databaseEngine.getDataMountPath())
                .build());
        } catch (ContainerStartException e) {
            throw new DatabaseException(DatabaseException.ERROR_CODE_INIT_FAILED,
                "数据库容器启动失败: " + e.getMessage(), e);
        } finally {
            portManagerService.release(port);
        }
        
        try {
            waitForDatabase(containerName, username);
        } catch (DatabaseException e) {
            log.error("数据库未能就绪，删除容器: {}", containerName);
            containerRuntime.forceRemoveContainer(containerName);
            throw e;
        }
        
        ManagedDatabase entity = new ManagedDatabase();
        entity.setId(id);
        entity.setName(name);
        entity.setEnvironment(environment);
        entity.setContainerName(containerName);
        entity.setHost(host);
        entity.setPort(port);
        entity.setUsername(username);
        entity.setPassword(password);
        entity.setDatabaseName(database);
        entity.setVolumePath(volumePath.toString());
        entity.setEngineVersion(version);
        entity.setSslMode(databaseProperties.getSslMode());
        entity.setStatus(DatabaseStatus.ACTIVE);
        entity.setCreatedAt(LocalDateTime.now());
        entity.setUpdatedAt(LocalDateTime.now());
        try {
            managedDatabaseMapper.insert(entity);
        } catch (RuntimeException e) {
            log.error("数据库登记失败，删除容器: {}", containerName, e);
            containerRuntime.forceRemoveContainer(containerName);
            throw new DatabaseException(DatabaseException.ERROR_CODE_INIT_FAILED,
                "数据库登记失败: " + containerName, e);
        }
        
        log.info("数据库创建成功: {} -> {}:{}", containerName, host, port);
        
        DatabaseCredentials credentials = new DatabaseCredentials();
        fillInfo(credentials, entity);
        credentials.setPassword(password);
        credentials.setConnectionString(databaseEngine.buildConnectionString(
            username, password, host, port, database, entity.getSslMode()));
        return credentials;
    }
    
    /**
     * 容器退出立即失败；就绪检查命令输出 accepting connections 视为就绪
     */
    void waitForDatabase(String containerName, String username) {
        PollPolicy policy = PollPolicy.of(databaseProperties.getReadyInterval(), databaseProperties.getReadyMaxAttempts());
        PollOutcome outcome = healthPoller.poll("数据库 " + containerName, policy, attempt -> {
            ContainerState state = containerRuntime.inspect(containerName);
            if (!state.isRunning()) {
                return ProbeResult.dead(containerRuntime.logs(containerName, databaseProperties.getFailureTailLines()));
            }
            CommandResult result = containerRuntime.exec(containerName, databaseEngine.getReadinessCommand(username));
            return databaseEngine.isReady(result.getOutput())
                ? ProbeResult.ready(result.getOutput())
                : ProbeResult.waiting(result.getOutput());
        }, CancellationToken.none());
        
        switch (outcome.getResult()) {
            case READY:
                return;
            case DEAD:
                throw new DatabaseException(DatabaseException.ERROR_CODE_NOT_READY,
                    "数据库容器意外停止: " + containerName + "\n" + outcome.getDetail());
            case CANCELLED:
                throw new DatabaseException(DatabaseException.ERROR_CODE_NOT_READY,
                    "等待数据库就绪被中断: " + containerName);
            default:
                throw new DatabaseException(DatabaseException.ERROR_CODE_NOT_READY,
                    String.format("数据库 %s 在 %d 次检查后仍未就绪", containerName, outcome.getAttempts()));
        }
    }
    
    public List<DatabaseInfo> listDatabases() {
        LambdaQueryWrapper<ManagedDatabase> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.orderByDesc(ManagedDatabase::getCreatedAt);
        return managedDatabaseMapper.selectList(queryWrapper).stream()
            .map(DatabaseManagerService::toInfo)
            .collect(Collectors.toList());
    }
    
    public DatabaseInfo getDatabase(String id) {
        return toInfo(requireDatabase(id));
    }
    
    /**
     * 容器未运行时返回 stopped 状态而不是报错
     */
    public DatabaseStats stats(String id) {
        ManagedDatabase db = requireDatabase(id);
        String containerName = db.getContainerName();
        
        ContainerState state = containerRuntime.inspect(containerName);
        if (!state.isRunning()) {
            return DatabaseStats.stopped();
        }
        
        CommandResult size = containerRuntime.exec(containerName,
            databaseEngine.getSizeQuery(db.getUsername(), db.getDatabaseName()));
        CommandResult connections = containerRuntime.exec(containerName,
            databaseEngine.getActiveConnectionsQuery(db.getUsername(), db.getDatabaseName()));
        ContainerStats usage = containerRuntime.stats(containerName);
        
        DatabaseStats stats = new DatabaseStats();
        stats.setStatus("running");
        stats.setSize(size.getOutput().trim());
        stats.setConnections(parseCount(connections.getOutput()));
        stats.setCpu(usage.getCpuPercent());
        stats.setMemory(usage.getMemoryUsage());
        stats.setUptime(state.getStartedAt() != null
            ? formatUptime(Duration.between(state.getStartedAt(), Instant.now()))
            : DatabaseStats.NOT_AVAILABLE);
        return stats;
    }
    
    private int parseCount(String output) {
        try {
            return Integer.parseInt(output.trim());
        } catch (NumberFormatException e) {
            log.debug("无法解析连接数: {}", output);
            return 0;
        }
    }
    
    static String formatUptime(Duration uptime) {
        long seconds = Math.max(0, uptime.getSeconds());
        long minutes = seconds / 60;
        long hours = minutes / 60;
        long days = hours / 24;
        if (days > 0) {
            return days + "d " + (hours % 24) + "h";
        }
        if (hours > 0) {
            return hours + "h " + (minutes % 60) + "m";
        }
        if (minutes > 0) {
            return minutes + "m";
        }
        return seconds + "s";
    }
    
    public DatabaseInfo startDatabase(String id) {
        ManagedDatabase db = requireDatabase(id);
        containerRuntime.startContainer(db.getContainerName());
        return toInfo(updateStatus(db, DatabaseStatus.ACTIVE));
    }
    
    public DatabaseInfo stopDatabase(String id) {
        ManagedDatabase db = requireDatabase(id);
        containerRuntime.stopContainer(db.getContainerName());
        return toInfo(updateStatus(db, DatabaseStatus.STOPPED));
    }
    
    public DatabaseInfo restartDatabase(String id) {
        ManagedDatabase db = requireDatabase(id);
        containerRuntime.restartContainer(db.getContainerName());
        return toInfo(updateStatus(db, DatabaseStatus.ACTIVE));
    }
    
    /**
     * 删除容器并注销实例；数据目录默认保留
     *
     * @param purgeStorage 同时删除数据目录
     */
    public void deleteDatabase(String id, boolean purgeStorage) {
        ManagedDatabase db = requireDatabase(id);
        containerRuntime.forceRemoveContainer(db.getContainerName());
        managedDatabaseMapper.deleteById(id);
        if (purgeStorage) {
            fileManagerService.deleteDirectory(Paths.get(db.getVolumePath()));
            log.info("数据库已删除（含数据目录）: {}", db.getContainerName());
        } else {
            log.info("数据库已删除，数据目录保留: {} ({})", db.getContainerName(), db.getVolumePath());
        }
    }
    
    private ManagedDatabase updateStatus(ManagedDatabase db, DatabaseStatus status) {
        db.setStatus(status);
        db.setUpdatedAt(LocalDateTime.now());
        managedDatabaseMapper.updateById(db);
        return db;
    }
    
    private ManagedDatabase requireDatabase(String id) {
        ManagedDatabase db = managedDatabaseMapper.selectById(id);
        if (db == null) {
            throw new DatabaseNotFoundException(id);
        }
        return db;
    }
    
    private ManagedDatabase findByNameAndEnvironment(String name, String environment) {
        LambdaQueryWrapper<ManagedDatabase> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ManagedDatabase::getName, name)
                    .eq(ManagedDatabase::getEnvironment, environment);
        return managedDatabaseMapper.selectOne(queryWrapper);
    }
    
    private boolean isRegisteredContainer(String containerName) {
        LambdaQueryWrapper<ManagedDatabase> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ManagedDatabase::getContainerName, containerName);
        Long count = managedDatabaseMapper.selectCount(queryWrapper);
        return count != null && count > 0;
    }
    
    static String generateId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        StringBuilder hex = new StringBuilder("db-");
        for (byte b : bytes) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }
    
    /**
     * 24 位，base64 字符集中的 + / 替换为字母，便于放进连接串
     */
    static String generatePassword() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes)
            .substring(0, 24)
            .replace('+', 'A')
            .replace('/', 'B');
    }
    
    static DatabaseInfo toInfo(ManagedDatabase entity) {
        DatabaseInfo info = new DatabaseInfo();
        fillInfo(info, entity);
        return info;
    }
    
    private static void fillInfo(DatabaseInfo info, ManagedDatabase entity) {
        info.setId(entity.getId());
        info.setName(entity.getName());
        info.setEnvironment(entity.getEnvironment());
        info.setContainerName(entity.getContainerName());
        info.setHost(entity.getHost());
        info.setPort(entity.getPort());
        info.setUsername(entity.getUsername());
        info.setDatabase(entity.getDatabaseName());
        info.setSslMode(entity.getSslMode());
        info.setEngineVersion(entity.getEngineVersion());
        info.setStatus(entity.getStatus());
        info.setCreatedAt(entity.getCreatedAt());
    }
}
