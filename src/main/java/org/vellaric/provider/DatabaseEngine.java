package org.vellaric.provider;

import java.util.Map;

/**
 * 数据库引擎接口
 * 封装镜像、容器参数、就绪检查和统计查询，容器本身由 ContainerRuntime 管理
 */
public interface DatabaseEngine {
    
    /**
     * 引擎类型（postgres 等）
     */
    String getEngineType();
    
    String getImage(String version);
    
    /**
     * 容器内监听端口
     */
    int getContainerPort();
    
    /**
     * 数据目录在容器内的挂载点
     */
    String getDataMountPath();
    
    Map<String, String> getContainerEnvironment(String username, String password, String database);
    
    /**
     * 在容器内执行的就绪检查命令
     */
    String[] getReadinessCommand(String username);
    
    boolean isReady(String readinessOutput);
    
    String[] getSizeQuery(String username, String database);
    
    String[] getActiveConnectionsQuery(String username, String database);
    
    String buildConnectionString(String username, String password, String host, int port, String database, String sslMode);
}
