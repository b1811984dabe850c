package org.vellaric.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 轮询最终结果
 */
@Data
@AllArgsConstructor
public class PollOutcome {
    
    public enum Result {
        READY,
        DEAD,
        TIMED_OUT,
        CANCELLED
    }
    
    private Result result;
    
    /**
     * 最后一次探测的说明（如容器最后日志）
     */
    private String detail;
    
    private int attempts;
    
    public boolean isReady() {
        return result == Result.READY;
    }
}
