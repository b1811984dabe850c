package org.vellaric.provider;

import org.vellaric.dto.enums.DnsMode;
import org.vellaric.exception.DnsException;

import java.util.LinkedHashMap;
import java.util.Map;

public class FakeDnsProvider implements DnsProvider {

    private final DnsMode mode;

    private final Map<String, String> records = new LinkedHashMap<>();

    private boolean failApi;

    public FakeDnsProvider(DnsMode mode) {
        this.mode = mode;
    }

    public void failApi() {
        this.failApi = true;
    }

    public Map<String, String> getRecords() {
        return records;
    }

    @Override
    public DnsMode getMode() {
        return mode;
    }

    @Override
    public void upsertARecord(String domain, String ipAddress) {
        if (failApi) {
            throw new DnsException("Cloudflare API 调用失败: 403");
        }
        records.put(domain, ipAddress);
    }

    @Override
    public void deleteRecord(String domain) {
        if (failApi) {
            throw new DnsException("Cloudflare API 调用失败: 403");
        }
        records.remove(domain);
    }
}
