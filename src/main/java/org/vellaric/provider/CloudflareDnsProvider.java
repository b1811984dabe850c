package org.vellaric.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.vellaric.config.NetworkProperties;
import org.vellaric.dto.enums.DnsMode;
import org.vellaric.exception.DnsException;

import java.util.Collections;

/**
 * Cloudflare DNS API：按域名最后两段查找 zone，管理 A 记录（TTL 自动、不走代理）
 */
@Slf4j
public class CloudflareDnsProvider implements DnsProvider {
    
    private final NetworkProperties.Cloudflare cloudflare;
    
    private final RestTemplate restTemplate;
    
    private final ObjectMapper objectMapper;
    
    public CloudflareDnsProvider(NetworkProperties networkProperties, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.cloudflare = networkProperties.getDns().getCloudflare();
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public DnsMode getMode() {
        return DnsMode.API;
    }
    
    @Override
    public void upsertARecord(String domain, String ipAddress) {
        String zoneId = getZoneId(domain);
        JsonNode existing = findRecord(zoneId, domain);
        
        ObjectNode body = objectMapper.createObjectNode();
        body.put("type", "A");
        body.put("name", domain);
        body.put("content", ipAddress);
        body.put("ttl", 1);
        body.put("proxied", false);
        
        if (existing != null) {
            log.info("更新 DNS 记录: {} -> {}", domain, ipAddress);
            request("/zones/" + zoneId + "/dns_records/" + existing.path("id").asText(), HttpMethod.PUT, body);
        } else {
            log.info("创建 DNS 记录: {} -> {}", domain, ipAddress);
            request("/zones/" + zoneId + "/dns_records", HttpMethod.POST, body);
        }
    }
    
    @Override
    public void deleteRecord(String domain) {
        String zoneId = getZoneId(domain);
        JsonNode existing = findRecord(zoneId, domain);
        if (existing == null) {
            log.info("DNS 记录不存在: {}", domain);
            return;
        }
        request("/zones/" + zoneId + "/dns_records/" + existing.path("id").asText(), HttpMethod.DELETE, null);
        log.info("已删除 DNS 记录: {}", domain);
    }
    
    static String rootDomain(String domain) {
        String[] parts = domain.split("\\.");
        if (parts.length <= 2) {
            return domain;
        }
        return parts[parts.length - 2] + "." + parts[parts.length - 1];
    }
    
    private String getZoneId(String domain) {
        String root = rootDomain(domain);
        JsonNode zones = request("/zones?name=" + root, HttpMethod.GET, null);
        if (!zones.isArray() || zones.size() == 0) {
            throw new DnsException("未找到域名对应的 zone: " + root);
        }
        return zones.get(0).path("id").asText();
    }
    
    private JsonNode findRecord(String zoneId, String domain) {
        JsonNode records = request("/zones/" + zoneId + "/dns_records?name=" + domain, HttpMethod.GET, null);
        return records.isArray() && records.size() > 0 ? records.get(0) : null;
    }
    
    /**
     * 返回响应中的 result 字段
     */
    private JsonNode request(String endpoint, HttpMethod method, JsonNode body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(cloudflare.getApiToken());
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<String> entity = new HttpEntity<>(body == null ? null : body.toString(), headers);
        
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(cloudflare.getApiBase() + endpoint, method, entity, JsonNode.class);
        } catch (RestClientException e) {
            throw new DnsException("Cloudflare API 请求失败: " + method + " " + endpoint, e);
        }
        
        JsonNode result = response.getBody();
        if (result == null || !result.path("success").asBoolean(false)) {
            String message = result != null && result.path("errors").size() > 0
                ? result.path("errors").get(0).path("message").asText()
                : "Cloudflare API 返回失败";
            throw new DnsException(message);
        }
        return result.path("result");
    }
}
