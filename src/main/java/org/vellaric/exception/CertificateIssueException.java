package org.vellaric.exception;

/**
 * 证书签发失败（非致命，部署仍以 HTTP 方式成功）
 */
public class CertificateIssueException extends PlatformException {
    
    public static final String ERROR_CODE = "CERTIFICATE_ISSUE_FAILED";
    
    public CertificateIssueException(String message) {
        super(ERROR_CODE, message);
    }
    
    public CertificateIssueException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
