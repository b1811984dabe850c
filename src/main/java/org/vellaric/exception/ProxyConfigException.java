package org.vellaric.exception;

/**
 * 反向代理配置写入或重载失败
 */
public class ProxyConfigException extends DeploymentException {
    
    public static final String ERROR_CODE = "PROXY_CONFIG_FAILED";
    
    public ProxyConfigException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ProxyConfigException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
