package org.vellaric.exception;

/**
 * 外部命令无法启动或被中断
 */
public class ProcessExecutionException extends PlatformException {
    
    public static final String ERROR_CODE = "PROCESS_EXECUTION_FAILED";
    
    public ProcessExecutionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
