package org.vellaric.dto.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 域名解析方式
 * - API: 通过 DNS 服务商 API 创建/更新了 A 记录
 * - WILDCARD: 未配置 API，依赖运维预先配置的泛解析
 * - FALLBACK: API 调用失败，退回泛解析
 */
public enum DnsMode {
    
    API("api"),
    WILDCARD("wildcard"),
    FALLBACK("fallback");
    
    private final String value;
    
    DnsMode(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
