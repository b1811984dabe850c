package org.vellaric.exception;

/**
 * 部署被取消（被新的部署取代或服务关闭）
 */
public class DeploymentCancelledException extends DeploymentException {
    
    public static final String ERROR_CODE = "DEPLOYMENT_CANCELLED";
    
    public DeploymentCancelledException(String reason) {
        super(ERROR_CODE, reason);
    }
}
