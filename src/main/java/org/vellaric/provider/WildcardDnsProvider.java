package org.vellaric.provider;

import lombok.extern.slf4j.Slf4j;
import org.vellaric.dto.enums.DnsMode;

/**
 * 泛解析模式：*.base-domain 已由运维指向本机，无需管理记录
 */
@Slf4j
public class WildcardDnsProvider implements DnsProvider {
    
    @Override
    public DnsMode getMode() {
        return DnsMode.WILDCARD;
    }
    
    @Override
    public void upsertARecord(String domain, String ipAddress) {
        log.info("使用泛解析，跳过 DNS 记录创建: {}", domain);
    }
    
    @Override
    public void deleteRecord(String domain) {
        log.info("使用泛解析，跳过 DNS 记录删除: {}", domain);
    }
}
