package org.vellaric.provider;

import org.vellaric.dto.enums.DnsMode;

/**
 * DNS 记录管理接口
 */
public interface DnsProvider {
    
    /**
     * API 表示由本平台管理记录，WILDCARD 表示依赖预先配置的泛解析
     */
    DnsMode getMode();
    
    /**
     * 创建或更新 A 记录
     *
     * @throws org.vellaric.exception.DnsException API 调用失败
     */
    void upsertARecord(String domain, String ipAddress);
    
    /**
     * 删除记录，不存在时什么都不做
     *
     * @throws org.vellaric.exception.DnsException API 调用失败
     */
    void deleteRecord(String domain);
}
