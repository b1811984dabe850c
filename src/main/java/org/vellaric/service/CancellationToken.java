package org.vellaric.service;

import org.vellaric.exception.DeploymentCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 协作式取消标记，在部署步骤之间和每次轮询之间检查
 */
public class CancellationToken {
    
    private final CountDownLatch cancelled = new CountDownLatch(1);
    
    private volatile String reason;
    
    /**
     * 永不取消的标记
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }
    
    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason;
        }
        cancelled.countDown();
    }
    
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
    
    public String getReason() {
        return reason;
    }
    
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new DeploymentCancelledException(reason != null ? reason : "部署已取消");
        }
    }
    
    /**
     * 等待指定时长，期间被取消则提前返回
     *
     * @return true 表示已被取消
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        return cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
