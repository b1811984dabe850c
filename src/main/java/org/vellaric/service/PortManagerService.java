package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.vellaric.config.PortProperties;
import org.vellaric.exception.PortException;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 端口管理服务
 * <p>
 * 扫描与预留在同一把进程级锁内完成；预留的端口在调用方 release 之前不会再被分配，
 * 调用方应在容器绑定端口（docker run 返回）之后释放预留。
 */
@Slf4j
@Service
public class PortManagerService {
    
    private final PortProperties portProperties;
    
    private final ReentrantLock allocationLock = new ReentrantLock();
    
    private final Set<Integer> reservedPorts = new HashSet<>();
    
    public PortManagerService(PortProperties portProperties) {
        this.portProperties = portProperties;
    }
    
    /**
     * 为应用容器分配宿主机端口
     */
    public int allocateAppPort() {
        return allocate(portProperties.getAppMin(), portProperties.getAppMax());
    }
    
    /**
     * 为数据库容器分配宿主机端口
     */
    public int allocateDatabasePort() {
        return allocate(portProperties.getDbMin(), portProperties.getDbMax());
    }
    
    /**
     * 在 [minPort, maxPort] 内分配一个当前未被占用且未被预留的端口
     */
    public int allocate(int minPort, int maxPort) {
        if (minPort <= 0 || maxPort > 65535 || minPort > maxPort) {
            throw new PortException(PortException.ERROR_CODE_INVALID_RANGE,
                String.format("端口范围无效 [%d-%d]", minPort, maxPort));
        }
        
        allocationLock.lock();
        try {
            for (int port = minPort; port <= maxPort; port++) {
                if (reservedPorts.contains(port)) {
                    continue;
                }
                if (!isPortAvailable(port)) {
                    continue;
                }
                reservedPorts.add(port);
                log.info("分配端口: {}", port);
                return port;
            }
        } finally {
            allocationLock.unlock();
        }
        
        throw new PortException(PortException.ERROR_CODE_NO_AVAILABLE_PORT,
            String.format("没有可用的端口，端口范围 [%d-%d] 已用完", minPort, maxPort));
    }
    
    /**
     * 释放预留（端口已被容器占用或启动失败）
     */
    public void release(Integer port) {
        if (port == null) {
            log.warn("端口号为空，无法释放");
            return;
        }
        allocationLock.lock();
        try {
            if (reservedPorts.remove(port)) {
                log.debug("释放端口预留: {}", port);
            }
        } finally {
            allocationLock.unlock();
        }
    }
    
    public Set<Integer> getReservedPorts() {
        allocationLock.lock();
        try {
            return Collections.unmodifiableSet(new HashSet<>(reservedPorts));
        } finally {
            allocationLock.unlock();
        }
    }
    
    /**
     * 检查端口是否可用（未被系统占用）
     */
    boolean isPortAvailable(int port) {
        try (ServerSocket serverSocket = new ServerSocket()) {
            serverSocket.setReuseAddress(false);
            serverSocket.bind(new InetSocketAddress(port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
