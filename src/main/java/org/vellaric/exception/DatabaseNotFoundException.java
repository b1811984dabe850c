package org.vellaric.exception;

/**
 * 数据库实例不存在
 */
public class DatabaseNotFoundException extends PlatformException {
    
    public static final String ERROR_CODE = "DATABASE_NOT_FOUND";
    
    public DatabaseNotFoundException(String id) {
        super(ERROR_CODE, "数据库实例不存在: " + id);
    }
}
