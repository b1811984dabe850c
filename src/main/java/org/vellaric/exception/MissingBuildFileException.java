package org.vellaric.exception;

/**
 * 仓库中没有 Dockerfile
 */
public class MissingBuildFileException extends DeploymentException {
    
    public static final String ERROR_CODE = "BUILD_FILE_MISSING";
    
    public MissingBuildFileException(String workspace) {
        super(ERROR_CODE, "仓库中未找到 Dockerfile: " + workspace);
    }
}
