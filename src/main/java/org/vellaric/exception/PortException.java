package org.vellaric.exception;

/**
 * 端口管理异常
 */
public class PortException extends PlatformException {
    
    public static final String ERROR_CODE_NO_AVAILABLE_PORT = "NO_AVAILABLE_PORT";
    public static final String ERROR_CODE_INVALID_RANGE = "INVALID_PORT_RANGE";
    
    public PortException(String errorCode, String message) {
        super(errorCode, message);
    }
}
