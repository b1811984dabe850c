package org.vellaric.exception;

/**
 * DNS API 调用失败
 */
public class DnsException extends PlatformException {
    
    public static final String ERROR_CODE = "DNS_API_FAILED";
    
    public DnsException(String message) {
        super(ERROR_CODE, message);
    }
    
    public DnsException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
