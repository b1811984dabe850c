package org.vellaric.exception;

/**
 * 容器运行时操作失败（启停、执行命令、查询）
 */
public class ContainerOperationException extends PlatformException {
    
    public static final String ERROR_CODE = "CONTAINER_OPERATION_FAILED";
    
    public ContainerOperationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ContainerOperationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
