package org.vellaric.exception;

/**
 * 镜像构建失败
 */
public class BuildException extends DeploymentException {
    
    public static final String ERROR_CODE = "IMAGE_BUILD_FAILED";
    
    public BuildException(String message) {
        super(ERROR_CODE, message);
    }
    
    public BuildException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
