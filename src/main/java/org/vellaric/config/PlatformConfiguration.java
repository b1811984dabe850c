package org.vellaric.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.vellaric.provider.CloudflareDnsProvider;
import org.vellaric.provider.DnsProvider;
import org.vellaric.provider.WildcardDnsProvider;

import java.time.Duration;

/**
 * 外部依赖装配：HTTP 客户端与 DNS 提供方
 */
@Slf4j
@Configuration
public class PlatformConfiguration {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(10))
            .setReadTimeout(Duration.ofSeconds(30))
            .build();
    }

    /**
     * 配置了 Cloudflare API 令牌时直接管理 A 记录，否则依赖运维预先配置的泛解析
     */
    @Bean
    public DnsProvider dnsProvider(NetworkProperties networkProperties,
                                   RestTemplate restTemplate,
                                   ObjectMapper objectMapper) {
        if (networkProperties.getDns().getCloudflare().isConfigured()) {
            log.info("DNS 模式: Cloudflare API");
            return new CloudflareDnsProvider(networkProperties, restTemplate, objectMapper);
        }
        log.info("DNS 模式: 泛解析（未配置 Cloudflare API 令牌）");
        return new WildcardDnsProvider();
    }
}
