package org.vellaric.exception;

/**
 * 部署失败异常（致命错误，部署记录会被标记为 failed）
 */
public class DeploymentException extends PlatformException {
    
    public static final String ERROR_CODE_IN_PROGRESS = "DEPLOYMENT_IN_PROGRESS";
    
    public DeploymentException(String errorCode, String message) {
        super(errorCode, message);
    }
    
    public DeploymentException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
