package org.vellaric.dto;

import lombok.Data;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DnsMode;

/**
 * 容器与公网域名的绑定
 */
@Data
public class DomainBinding {
    
    private String domain;
    
    private Integer targetPort;
    
    private String containerName;
    
    private DnsMode dnsMode;
    
    private CertificateState certificateState = CertificateState.NONE;
    
    /**
     * 证书签发失败原因
     */
    private String certificateError;
    
    public boolean isHttps() {
        return certificateState == CertificateState.ISSUED;
    }
}
