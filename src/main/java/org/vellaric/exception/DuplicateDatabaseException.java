package org.vellaric.exception;

/**
 * 同名同环境的数据库实例已存在
 */
public class DuplicateDatabaseException extends PlatformException {
    
    public static final String ERROR_CODE = "DATABASE_ALREADY_EXISTS";
    
    public DuplicateDatabaseException(String name, String environment) {
        super(ERROR_CODE, String.format("数据库 \"%s\" 在 %s 环境中已存在", name, environment));
    }
}
