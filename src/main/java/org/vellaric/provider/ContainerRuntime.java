package org.vellaric.provider;

import org.vellaric.dto.CommandResult;
import org.vellaric.dto.ContainerSpec;
import org.vellaric.dto.ContainerState;
import org.vellaric.dto.ContainerStats;

import java.nio.file.Path;

/**
 * 容器引擎接口
 * 部署流水线和数据库管理只通过此接口操作容器，测试中以内存实现替换
 */
public interface ContainerRuntime {
    
    boolean containerExists(String name);
    
    /**
     * 停止并删除容器，容器不存在时什么都不做
     */
    void forceRemoveContainer(String name);
    
    /**
     * 删除镜像，镜像不存在时什么都不做
     */
    void removeImage(String image);
    
    /**
     * 以 contextDir 为上下文、不使用缓存构建镜像
     *
     * @throws org.vellaric.exception.BuildException 构建失败
     */
    void buildImage(Path contextDir, String tag);
    
    /**
     * 后台启动容器
     *
     * @return 容器 ID
     * @throws org.vellaric.exception.ContainerStartException 启动失败
     */
    String runContainer(ContainerSpec spec);
    
    ContainerState inspect(String name);
    
    /**
     * 最后 tail 行日志（stdout + stderr）
     */
    String logs(String name, int tail);
    
    void startContainer(String name);
    
    void stopContainer(String name);
    
    void restartContainer(String name);
    
    /**
     * 在运行中的容器内执行命令
     */
    CommandResult exec(String name, String... command);
    
    ContainerStats stats(String name);
    
    /**
     * 清理所有未使用的镜像
     */
    String pruneImages();
}
