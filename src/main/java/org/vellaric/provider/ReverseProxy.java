package org.vellaric.provider;

/**
 * 反向代理接口
 */
public interface ReverseProxy {
    
    /**
     * 写入（覆盖）站点配置并校验
     *
     * @throws org.vellaric.exception.ProxyConfigException 写入或校验失败
     */
    void writeSite(String domain, int port, String containerName);
    
    boolean siteExists(String domain);
    
    void removeSite(String domain);
    
    /**
     * @throws org.vellaric.exception.ProxyConfigException 重载失败
     */
    void reload();
}
