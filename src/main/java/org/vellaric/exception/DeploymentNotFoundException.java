package org.vellaric.exception;

/**
 * 部署记录不存在
 */
public class DeploymentNotFoundException extends PlatformException {
    
    public static final String ERROR_CODE = "DEPLOYMENT_NOT_FOUND";
    
    public DeploymentNotFoundException(String id) {
        super(ERROR_CODE, "部署记录不存在: " + id);
    }
}
