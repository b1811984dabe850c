package org.vellaric.dto.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 域名证书状态。FAILED 时站点仍可通过 HTTP 访问
 */
public enum CertificateState {
    
    NONE("none"),
    PENDING("pending"),
    ISSUED("issued"),
    FAILED("failed");
    
    @EnumValue
    private final String value;
    
    CertificateState(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
