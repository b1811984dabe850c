package org.vellaric.exception;

/**
 * 容器在健康检查期限内未就绪
 */
public class HealthTimeoutException extends DeploymentException {
    
    public static final String ERROR_CODE = "CONTAINER_HEALTH_CHECK_TIMEOUT";
    
    public HealthTimeoutException(String message) {
        super(ERROR_CODE, message);
    }
    
    protected HealthTimeoutException(String errorCode, String message) {
        super(errorCode, message);
    }
}
