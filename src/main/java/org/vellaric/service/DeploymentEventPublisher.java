package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.vellaric.dto.DeploymentStatusEvent;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * 把状态事件按顺序异步分发给所有监听器，监听器异常只记录日志
 */
@Slf4j
@Component
public class DeploymentEventPublisher {
    
    private final List<DeploymentStatusListener> listeners;
    
    private final Executor dispatcher;
    
    @Autowired
    public DeploymentEventPublisher(List<DeploymentStatusListener> listeners) {
        this(listeners, Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "deployment-events");
            thread.setDaemon(true);
            return thread;
        }));
    }
    
    /**
     * @param dispatcher 必须按提交顺序执行
     */
    public DeploymentEventPublisher(List<DeploymentStatusListener> listeners, Executor dispatcher) {
        this.listeners = listeners != null ? new ArrayList<>(listeners) : new ArrayList<>();
        this.dispatcher = dispatcher;
        for (DeploymentStatusListener listener : this.listeners) {
            log.info("注册部署状态监听器: {}", listener.getClass().getSimpleName());
        }
    }
    
    public void publish(DeploymentStatusEvent event) {
        try {
            dispatcher.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("事件分发器已关闭，丢弃部署状态事件: {} -> {}", event.getId(), event.getStatus());
        }
    }
    
    private void deliver(DeploymentStatusEvent event) {
        for (DeploymentStatusListener listener : listeners) {
            try {
                listener.onStatusChange(event);
            } catch (RuntimeException e) {
                log.warn("部署状态监听器处理失败: listener={}, deploymentId={}",
                    listener.getClass().getSimpleName(), event.getId(), e);
            }
        }
    }
    
    @PreDestroy
    public void destroy() {
        if (dispatcher instanceof ExecutorService) {
            ((ExecutorService) dispatcher).shutdown();
        }
    }
}
