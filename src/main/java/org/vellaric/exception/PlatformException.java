package org.vellaric.exception;

/**
 * 平台异常基类
 */
public class PlatformException extends RuntimeException {
    
    private String errorCode;
    
    public PlatformException(String message) {
        super(message);
    }
    
    public PlatformException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
    
    public PlatformException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
