package org.vellaric.exception;

/**
 * 请求参数不合法
 */
public class InvalidRequestException extends PlatformException {
    
    public static final String ERROR_CODE = "INVALID_REQUEST";
    
    public InvalidRequestException(String message) {
        super(ERROR_CODE, message);
    }
}
