package org.vellaric.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * docker stats 的 CPU / 内存占用
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContainerStats {
    
    private String cpuPercent;
    
    private String memoryUsage;
}
