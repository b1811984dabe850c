package org.vellaric.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 单次就绪探测的结果
 */
@Data
@AllArgsConstructor
public class ProbeResult {
    
    public enum State {
        READY,
        WAITING,
        /**
         * 被探测对象已经退出，不再重试
         */
        DEAD
    }
    
    private State state;
    
    private String detail;
    
    public static ProbeResult ready(String detail) {
        return new ProbeResult(State.READY, detail);
    }
    
    public static ProbeResult waiting() {
        return new ProbeResult(State.WAITING, null);
    }
    
    public static ProbeResult waiting(String detail) {
        return new ProbeResult(State.WAITING, detail);
    }
    
    public static ProbeResult dead(String detail) {
        return new ProbeResult(State.DEAD, detail);
    }
}
