package org.vellaric.exception;

/**
 * 容器启动失败
 */
public class ContainerStartException extends DeploymentException {
    
    public static final String ERROR_CODE = "CONTAINER_START_FAILED";
    
    public ContainerStartException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ContainerStartException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
