package org.vellaric.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;

/**
 * 轮询策略：固定间隔、有限次数
 */
@Data
@AllArgsConstructor
public class PollPolicy {
    
    private Duration interval;
    
    private int maxAttempts;
    
    public static PollPolicy of(Duration interval, int maxAttempts) {
        return new PollPolicy(interval, maxAttempts);
    }
}
