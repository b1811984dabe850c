package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.vellaric.dto.PollOutcome;
import org.vellaric.dto.PollPolicy;
import org.vellaric.dto.ProbeResult;

/**
 * 有界轮询，容器就绪、数据库就绪和 DNS 生效检查共用
 */
@Slf4j
@Component
public class HealthPoller {
    
    /**
     * 按策略轮询直到就绪、对象退出、次数耗尽或被取消。
     * 探测抛出的异常按"尚未就绪"处理
     *
     * @param subject 被探测对象名，仅用于日志
     */
    public PollOutcome poll(String subject, PollPolicy policy, ReadinessProbe probe, CancellationToken token) {
        String lastDetail = null;
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            if (token.isCancelled()) {
                log.info("轮询已取消: {}, 第 {} 次", subject, attempt);
                return new PollOutcome(PollOutcome.Result.CANCELLED, token.getReason(), attempt - 1);
            }
            
            ProbeResult result;
            try {
                result = probe.probe(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new PollOutcome(PollOutcome.Result.CANCELLED, "轮询被中断", attempt);
            } catch (Exception e) {
                log.warn("探测 {} 失败（第 {}/{} 次）: {}", subject, attempt, policy.getMaxAttempts(), e.getMessage());
                result = ProbeResult.waiting(e.getMessage());
            }
            
            if (result.getDetail() != null) {
                lastDetail = result.getDetail();
            }
            switch (result.getState()) {
                case READY:
                    log.info("{} 已就绪（第 {} 次检查）", subject, attempt);
                    return new PollOutcome(PollOutcome.Result.READY, result.getDetail(), attempt);
                case DEAD:
                    log.warn("{} 已退出，停止轮询（第 {} 次检查）", subject, attempt);
                    return new PollOutcome(PollOutcome.Result.DEAD, result.getDetail(), attempt);
                default:
                    break;
            }
            
            if (attempt < policy.getMaxAttempts()) {
                try {
                    if (token.sleep(policy.getInterval())) {
                        return new PollOutcome(PollOutcome.Result.CANCELLED, token.getReason(), attempt);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new PollOutcome(PollOutcome.Result.CANCELLED, "轮询被中断", attempt);
                }
            }
        }
        
        log.warn("{} 在 {} 次检查后仍未就绪", subject, policy.getMaxAttempts());
        return new PollOutcome(PollOutcome.Result.TIMED_OUT, lastDetail, policy.getMaxAttempts());
    }
}
