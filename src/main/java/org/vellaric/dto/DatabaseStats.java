package org.vellaric.dto;

import lombok.Data;

/**
 * 数据库运行状态
 */
@Data
public class DatabaseStats {
    
    public static final String NOT_AVAILABLE = "N/A";
    
    /**
     * running / stopped
     */
    private String status;
    
    private String size;
    
    private int connections;
    
    private String cpu;
    
    private String memory;
    
    private String uptime;
    
    public static DatabaseStats stopped() {
        DatabaseStats stats = new DatabaseStats();
        stats.setStatus("stopped");
        stats.setSize(NOT_AVAILABLE);
        stats.setConnections(0);
        stats.setUptime(NOT_AVAILABLE);
        return stats;
    }
}
