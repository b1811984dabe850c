package org.vellaric.service;

import org.vellaric.dto.ProbeResult;

/**
 * 就绪探测，attempt 从 1 开始
 */
@FunctionalInterface
public interface ReadinessProbe {
    
    ProbeResult probe(int attempt) throws Exception;
}
