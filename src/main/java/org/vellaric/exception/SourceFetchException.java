package org.vellaric.exception;

/**
 * 源码拉取失败（clone / pull）
 */
public class SourceFetchException extends DeploymentException {
    
    public static final String ERROR_CODE = "SOURCE_FETCH_FAILED";
    
    public SourceFetchException(String message) {
        super(ERROR_CODE, message);
    }
    
    public SourceFetchException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
