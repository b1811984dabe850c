package org.vellaric.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.vellaric.config.NetworkProperties;
import org.vellaric.dto.DomainBinding;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DnsMode;
import org.vellaric.exception.DnsException;
import org.vellaric.exception.PlatformException;
import org.vellaric.exception.ProxyConfigException;
import org.vellaric.provider.CertificateAuthority;
import org.vellaric.provider.DnsProvider;
import org.vellaric.provider.ReverseProxy;

/**
 * 域名接入：DNS 记录、反向代理和 HTTPS 证书。
 * 只有反向代理失败会让部署失败，DNS 与证书问题记录在 DomainBinding 上
 */
@Slf4j
@Service
public class NetworkProvisionService {
    
    static final String DNS_NOT_PROPAGATED = "DNS 未生效，跳过证书申请";
    
    private final DnsProvider dnsProvider;
    
    private final ReverseProxy reverseProxy;
    
    private final CertificateAuthority certificateAuthority;
    
    private final PublicDnsResolver publicDnsResolver;
    
    private final NetworkProperties networkProperties;
    
    private final RestTemplate restTemplate;
    
    private final DeploymentLogService deploymentLogService;
    
    public NetworkProvisionService(DnsProvider dnsProvider,
                                   ReverseProxy reverseProxy,
                                   CertificateAuthority certificateAuthority,
                                   PublicDnsResolver publicDnsResolver,
                                   NetworkProperties networkProperties,
                                   RestTemplate restTemplate,
                                   DeploymentLogService deploymentLogService) {
        this.dnsProvider = dnsProvider;
        this.reverseProxy = reverseProxy;
        this.certificateAuthority = certificateAuthority;
        this.publicDnsResolver = publicDnsResolver;
        this.networkProperties = networkProperties;
        this.restTemplate = restTemplate;
        this.deploymentLogService = deploymentLogService;
    }
    
    /**
     * @throws ProxyConfigException 反向代理配置写入或重载失败
     */
    public DomainBinding provision(String deploymentId, String domain, int port, String containerName,
                                   CancellationToken token) {
        DomainBinding binding = new DomainBinding();
        binding.setDomain(domain);
        binding.setTargetPort(port);
        binding.setContainerName(containerName);
        
        // 1. DNS
        binding.setDnsMode(setupDns(deploymentId, domain));
        
        // 2. 反向代理
        token.throwIfCancelled();
        step(deploymentId, "配置反向代理: " + domain + " -> 127.0.0.1:" + port);
        reverseProxy.writeSite(domain, port, containerName);
        reverseProxy.reload();
        
        // 3-4. 证书
        if (!networkProperties.getSsl().isEnabled()) {
            step(deploymentId, "未启用 HTTPS，仅提供 HTTP 访问");
            return binding;
        }
        issueCertificate(deploymentId, binding, token);
        return binding;
    }
    
    private DnsMode setupDns(String deploymentId, String domain) {
        if (dnsProvider.getMode() != DnsMode.API) {
            step(deploymentId, "使用泛解析: " + domain);
            return DnsMode.WILDCARD;
        }
        try {
            String ip = resolvePublicIp();
            dnsProvider.upsertARecord(domain, ip);
            step(deploymentId, "DNS 记录已更新: " + domain + " -> " + ip);
            return DnsMode.API;
        } catch (DnsException e) {
            log.warn("DNS 配置失败，回退到泛解析: {}", e.getMessage());
            deploymentLogService.warn(deploymentId, "DNS 配置失败，回退到泛解析: " + e.getMessage());
            return DnsMode.FALLBACK;
        }
    }
    
    /**
     * 优先使用配置的公网 IP，否则在线查询
     */
    String resolvePublicIp() {
        NetworkProperties.Network network = networkProperties.getNetwork();
        if (StringUtils.hasText(network.getPublicIp())) {
            return network.getPublicIp().trim();
        }
        try {
            JsonNode response = restTemplate.getForObject(network.getIpLookupUrl(), JsonNode.class);
            String ip = response != null ? response.path("ip").asText(null) : null;
            if (!StringUtils.hasText(ip)) {
                throw new DnsException("无法获取公网 IP");
            }
            return ip;
        } catch (RestClientException e) {
            throw new DnsException("无法获取公网 IP: " + e.getMessage(), e);
        }
    }
    
    /**
     * 等待 DNS 生效后申请证书；失败只记录在 binding 上
     */
    private void issueCertificate(String deploymentId, DomainBinding binding, CancellationToken token) {
        String domain = binding.getDomain();
        binding.setCertificateState(CertificateState.PENDING);
        
        step(deploymentId, "等待 DNS 生效: " + domain);
        if (!publicDnsResolver.waitForPropagation(domain, token)) {
            token.throwIfCancelled();
            certificateFailed(deploymentId, binding, DNS_NOT_PROPAGATED);
            return;
        }
        
        step(deploymentId, "申请 HTTPS 证书: " + domain);
        try {
            certificateAuthority.issue(domain);
            reverseProxy.reload();
            binding.setCertificateState(CertificateState.ISSUED);
            binding.setCertificateError(null);
            step(deploymentId, "HTTPS 已启用: https://" + domain);
        } catch (PlatformException e) {
            // certbot 缺失、超时或 nginx 重载失败同样只影响证书
            certificateFailed(deploymentId, binding, e.getMessage());
        }
    }
    
    private void certificateFailed(String deploymentId, DomainBinding binding, String reason) {
        binding.setCertificateState(CertificateState.FAILED);
        binding.setCertificateError(reason);
        log.warn("证书未配置，{} 仅提供 HTTP 访问: {}", binding.getDomain(), reason);
        deploymentLogService.warn(deploymentId, "证书未配置，仅提供 HTTP 访问: " + reason);
    }
    
    /**
     * 手动重试证书申请，可重复调用
     */
    public DomainBinding reissueCertificate(String domain, int port, String containerName) {
        if (!reverseProxy.siteExists(domain)) {
            throw new ProxyConfigException("站点未配置，无法申请证书: " + domain);
        }
        DomainBinding binding = new DomainBinding();
        binding.setDomain(domain);
        binding.setTargetPort(port);
        binding.setContainerName(containerName);
        binding.setDnsMode(dnsProvider.getMode());
        issueCertificate(null, binding, CancellationToken.none());
        return binding;
    }
    
    /**
     * 续期证书
     */
    public void renewCertificate(String domain) {
        certificateAuthority.renew(domain);
        reverseProxy.reload();
    }
    
    /**
     * 删除站点配置与 DNS 记录；证书保留
     */
    public void deprovision(String domain) {
        reverseProxy.removeSite(domain);
        try {
            reverseProxy.reload();
        } catch (ProxyConfigException e) {
            log.warn("删除站点后 nginx 重载失败: {}", e.getMessage());
        }
        if (dnsProvider.getMode() == DnsMode.API) {
            try {
                dnsProvider.deleteRecord(domain);
            } catch (DnsException e) {
                log.warn("删除 DNS 记录失败: {} - {}", domain, e.getMessage());
            }
        }
        log.info("已移除域名绑定: {}", domain);
    }
    
    private void step(String deploymentId, String message) {
        log.info("{}", message);
        deploymentLogService.info(deploymentId, message);
    }
}
