package org.vellaric.exception;

/**
 * 数据库实例操作异常
 */
public class DatabaseException extends PlatformException {
    
    public static final String ERROR_CODE_INIT_FAILED = "DATABASE_INIT_FAILED";
    public static final String ERROR_CODE_NOT_READY = "DATABASE_NOT_READY";
    public static final String ERROR_CODE_OPERATION_FAILED = "DATABASE_OPERATION_FAILED";
    
    public DatabaseException(String errorCode, String message) {
        super(errorCode, message);
    }
    
    public DatabaseException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
