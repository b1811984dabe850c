package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.vellaric.config.DeployProperties;
import org.vellaric.dto.ContainerInstance;
import org.vellaric.dto.DeploymentInfo;
import org.vellaric.dto.DeploymentKeys;
import org.vellaric.dto.DeploymentRecord;
import org.vellaric.dto.DeploymentRequest;
import org.vellaric.dto.DeploymentStatusEvent;
import org.vellaric.dto.DomainBinding;
import org.vellaric.dto.QueueStatus;
import org.vellaric.dto.enums.DeploymentStatus;
import org.vellaric.exception.DeploymentCancelledException;
import org.vellaric.exception.InvalidRequestException;

import javax.annotation.PreDestroy;
import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 部署队列与调度
 * <p>
 * 单一 FIFO 队列 + 有界并发：调度时从队首开始，在 activeCount &lt; capacity 时把请求提升为 building 并交给工作线程。
 * 同一 (项目, 分支) 同时最多一个 building，后来的请求留在队列中等待；开启 supersede-in-flight 时，
 * 新请求会取消正在构建的同名部署，并让更早的排队请求失败。
 * 所有记录状态只在 lock 内修改。
 */
@Slf4j
@Service
public class DeploymentQueueService {
    
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private final ContainerLifecycleService containerLifecycleService;
    
    private final NetworkProvisionService networkProvisionService;
    
    private final DeploymentNaming naming;
    
    private final DeploymentEventPublisher eventPublisher;
    
    private final DeploymentLogService deploymentLogService;
    
    private final DeployProperties deployProperties;
    
    private final ExecutorService executor;
    
    private final ReentrantLock lock = new ReentrantLock();
    
    private final LinkedList<DeploymentRecord> pending = new LinkedList<>();
    
    private final Map<String, DeploymentRecord> building = new LinkedHashMap<>();
    
    /**
     * 所有已知记录（含已结束、保留期内的）
     */
    private final Map<String, DeploymentRecord> records = new LinkedHashMap<>();
    
    private int activeCount;
    
    private boolean shuttingDown;
    
    @Autowired
    public DeploymentQueueService(ContainerLifecycleService containerLifecycleService,
                                  NetworkProvisionService networkProvisionService,
                                  DeploymentNaming naming,
                                  DeploymentEventPublisher eventPublisher,
                                  DeploymentLogService deploymentLogService,
                                  DeployProperties deployProperties) {
        this(containerLifecycleService, networkProvisionService, naming, eventPublisher,
            deploymentLogService, deployProperties, Executors.newCachedThreadPool(new WorkerThreadFactory()));
    }
    
    DeploymentQueueService(ContainerLifecycleService containerLifecycleService,
                           NetworkProvisionService networkProvisionService,
                           DeploymentNaming naming,
                           DeploymentEventPublisher eventPublisher,
                           DeploymentLogService deploymentLogService,
                           DeployProperties deployProperties,
                           ExecutorService executor) {
        this.containerLifecycleService = containerLifecycleService;
        this.networkProvisionService = networkProvisionService;
        this.naming = naming;
        this.eventPublisher = eventPublisher;
        this.deploymentLogService = deploymentLogService;
        this.deployProperties = deployProperties;
        this.executor = executor;
    }
    
    /**
     * 加入队列并触发调度，立即返回部署 ID
     */
    public String enqueue(DeploymentRequest request) {
        validate(request);
        String id = generateId();
        DeploymentRecord record = new DeploymentRecord(id, request);
        
        List<DeploymentRecord> toStart;
        lock.lock();
        try {
            if (shuttingDown) {
                throw new InvalidRequestException("服务正在关闭，不再接受部署");
            }
            purgeExpiredRecords();
            if (deployProperties.isSupersedeInFlight()) {
                supersede(record);
            }
            record.setQueuedAt(LocalDateTime.now());
            records.put(id, record);
            pending.addLast(record);
            emit(record);
            log.info("部署已加入队列: {} {}/{} (队列长度: {})",
                id, request.getProjectName(), request.getBranch(), pending.size());
            toStart = schedule();
        } finally {
            lock.unlock();
        }
        deploymentLogService.info(id, "部署已加入队列: " + request.getProjectName() + " (" + request.getBranch() + ")");
        dispatch(toStart);
        return id;
    }
    
    private void validate(DeploymentRequest request) {
        if (request == null
                || !StringUtils.hasText(request.getProjectName())
                || !StringUtils.hasText(request.getRepoUrl())
                || !StringUtils.hasText(request.getBranch())) {
            throw new InvalidRequestException("缺少必填字段: projectName, repoUrl, branch");
        }
    }
    
    /**
     * 取消同一 (项目, 分支) 正在构建的部署，更早排队的请求直接失败
     */
    private void supersede(DeploymentRecord newer) {
        String pairKey = newer.pairKey();
        for (DeploymentRecord active : building.values()) {
            if (active.pairKey().equals(pairKey)) {
                log.info("部署 {} 被新的部署 {} 取代，取消构建", active.getId(), newer.getId());
                active.getCancellationToken().cancel("被新的部署取代: " + newer.getId());
            }
        }
        Iterator<DeploymentRecord> it = pending.iterator();
        while (it.hasNext()) {
            DeploymentRecord queued = it.next();
            if (queued.pairKey().equals(pairKey)) {
                it.remove();
                queued.setStatus(DeploymentStatus.FAILED);
                queued.setError("被新的部署取代: " + newer.getId());
                queued.setFailedAt(LocalDateTime.now());
                emit(queued);
                deploymentLogService.markCompleted(queued.getId());
                log.info("排队中的部署 {} 被新的部署 {} 取代", queued.getId(), newer.getId());
            }
        }
    }
    
    /**
     * 调度：调用方必须持有 lock
     *
     * @return 需要启动的记录
     */
    private List<DeploymentRecord> schedule() {
        List<DeploymentRecord> toStart = new ArrayList<>();
        int capacity = deployProperties.getMaxConcurrent();
        Iterator<DeploymentRecord> it = pending.iterator();
        while (it.hasNext() && activeCount < capacity && !shuttingDown) {
            DeploymentRecord record = it.next();
            if (isBuilding(record.pairKey())) {
                continue;
            }
            it.remove();
            record.setStatus(DeploymentStatus.BUILDING);
            record.setStartedAt(LocalDateTime.now());
            building.put(record.getId(), record);
            activeCount++;
            emit(record);
            toStart.add(record);
            log.info("开始部署: {} ({}/{})", record.getId(), activeCount, capacity);
        }
        return toStart;
    }
    
    private boolean isBuilding(String pairKey) {
        for (DeploymentRecord active : building.values()) {
            if (active.pairKey().equals(pairKey)) {
                return true;
            }
        }
        return false;
    }
    
    private void dispatch(List<DeploymentRecord> toStart) {
        for (DeploymentRecord record : toStart) {
            try {
                executor.execute(() -> runDeployment(record));
            } catch (RejectedExecutionException e) {
                log.error("部署线程池拒绝任务: {}", record.getId(), e);
                complete(record, null, null, "服务正在关闭，部署未执行");
            }
        }
    }
    
    private void runDeployment(DeploymentRecord record) {
        String id = record.getId();
        DeploymentRequest request = record.getRequest();
        CancellationToken token = record.getCancellationToken();
        try {
            String containerName = naming.containerName(request.getProjectName(), request.getBranch());
            String domain = naming.domain(request.getProjectName(), request.getBranch());
            update(record, r -> {
                r.setContainerName(containerName);
                r.setDomain(domain);
            });
            
            ContainerInstance instance = containerLifecycleService.deployContainer(id, request, domain, token);
            update(record, r -> {
                r.setPort(instance.getHostPort());
                r.setContainerId(instance.getContainerId());
            });
            
            DomainBinding binding = networkProvisionService.provision(
                id, domain, instance.getHostPort(), instance.getContainerName(), token);
            complete(record, instance, binding, null);
        } catch (DeploymentCancelledException e) {
            log.warn("部署已取消: {} - {}", id, e.getMessage());
            complete(record, null, null, "部署已取消: " + e.getMessage());
        } catch (Exception e) {
            log.error("部署失败: {}", id, e);
            complete(record, null, null, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
    
    private void update(DeploymentRecord record, Consumer<DeploymentRecord> mutation) {
        lock.lock();
        try {
            mutation.accept(record);
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * error 为空表示成功
     */
    private void complete(DeploymentRecord record, ContainerInstance instance, DomainBinding binding, String error) {
        List<DeploymentRecord> toStart;
        lock.lock();
        try {
            if (error == null) {
                record.setStatus(DeploymentStatus.SUCCESS);
                record.setDeployedAt(LocalDateTime.now());
                record.setPort(instance.getHostPort());
                record.setContainerName(instance.getContainerName());
                record.setContainerId(instance.getContainerId());
                record.setDomain(binding.getDomain());
                record.setCertificateState(binding.getCertificateState());
                record.setCertificateError(binding.getCertificateError());
            } else {
                record.setStatus(DeploymentStatus.FAILED);
                record.setError(error);
                record.setFailedAt(LocalDateTime.now());
            }
            if (building.remove(record.getId()) != null) {
                activeCount--;
            }
            emit(record);
            toStart = schedule();
        } finally {
            lock.unlock();
        }
        
        if (error == null) {
            deploymentLogService.info(record.getId(), "部署成功: " + (binding.isHttps() ? "https://" : "http://") + binding.getDomain());
            log.info("部署成功: {} -> {}", record.getId(), binding.getDomain());
        } else {
            deploymentLogService.error(record.getId(), "部署失败: " + error);
        }
        deploymentLogService.markCompleted(record.getId());
        dispatch(toStart);
    }
    
    /**
     * 调用方必须持有 lock，保证同一记录的事件按状态顺序发出
     */
    private void emit(DeploymentRecord record) {
        DeploymentInfo snapshot = record.toInfo();
        eventPublisher.publish(DeploymentStatusEvent.builder()
            .id(record.getId())
            .projectName(snapshot.getProjectName())
            .branch(snapshot.getBranch())
            .status(snapshot.getStatus())
            .domain(snapshot.getDomain())
            .port(snapshot.getPort())
            .certificateState(snapshot.getCertificateState())
            .error(snapshot.getError())
            .timestamp(LocalDateTime.now())
            .deployment(snapshot)
            .build());
    }
    
    public QueueStatus status() {
        lock.lock();
        try {
            QueueStatus status = new QueueStatus();
            status.setPending(pending.stream().map(DeploymentRecord::toInfo).collect(Collectors.toList()));
            status.setBuilding(building.values().stream().map(DeploymentRecord::toInfo).collect(Collectors.toList()));
            status.setQueued(pending.size());
            status.setActiveCount(activeCount);
            status.setCapacity(deployProperties.getMaxConcurrent());
            return status;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * 内存中的记录快照，已过保留期或未知返回 null
     */
    public DeploymentInfo getRecord(String id) {
        lock.lock();
        try {
            DeploymentRecord record = records.get(id);
            return record != null ? record.toInfo() : null;
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * 该 (项目, 分支) 是否有排队或构建中的部署
     */
    public boolean isActive(String projectName, String branch) {
        String pairKey = DeploymentKeys.pairKey(projectName, branch);
        lock.lock();
        try {
            return isBuilding(pairKey) || pending.stream().anyMatch(r -> r.pairKey().equals(pairKey));
        } finally {
            lock.unlock();
        }
    }
    
    private void purgeExpiredRecords() {
        LocalDateTime cutoff = LocalDateTime.now().minus(deployProperties.getRetention());
        records.values().removeIf(r -> {
            LocalDateTime finishedAt = r.getDeployedAt() != null ? r.getDeployedAt() : r.getFailedAt();
            return r.getStatus().isTerminal() && finishedAt != null && finishedAt.isBefore(cutoff);
        });
    }
    
    static String generateId() {
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(RANDOM.nextInt(ID_ALPHABET.length())));
        }
        return "deploy_" + System.currentTimeMillis() + "_" + suffix;
    }
    
    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            shuttingDown = true;
            for (DeploymentRecord active : building.values()) {
                active.getCancellationToken().cancel("服务关闭");
            }
            for (DeploymentRecord queued : pending) {
                queued.setStatus(DeploymentStatus.FAILED);
                queued.setError("服务关闭，部署未执行");
                queued.setFailedAt(LocalDateTime.now());
                emit(queued);
            }
            pending.clear();
        } finally {
            lock.unlock();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("部署队列已关闭");
    }
    
    private static class WorkerThreadFactory implements ThreadFactory {
        
        private final AtomicInteger counter = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "deploy-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
