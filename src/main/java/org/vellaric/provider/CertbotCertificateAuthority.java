package org.vellaric.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.vellaric.config.NetworkProperties;
import org.vellaric.dto.CommandResult;
import org.vellaric.exception.CertificateIssueException;
import org.vellaric.exception.ProcessExecutionException;
import org.vellaric.service.ProcessRunner;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Let's Encrypt 证书（certbot --nginx）
 */
@Slf4j
@Component
public class CertbotCertificateAuthority implements CertificateAuthority {
    
    private final NetworkProperties networkProperties;
    
    private final ProcessRunner processRunner;
    
    public CertbotCertificateAuthority(NetworkProperties networkProperties, ProcessRunner processRunner) {
        this.networkProperties = networkProperties;
        this.processRunner = processRunner;
    }
    
    @Override
    public boolean certificateExists(String domain) {
        return Files.exists(Paths.get(networkProperties.getSsl().getLiveDir(), domain, "fullchain.pem"));
    }
    
    @Override
    public void issue(String domain) {
        String email = networkProperties.getSsl().getEmail();
        if (!StringUtils.hasText(email)) {
            throw new CertificateIssueException("未配置证书邮箱 platform.ssl.email");
        }
        log.info("申请证书: {}{}", domain, certificateExists(domain) ? "（已有证书，重新安装）" : "");
        CommandResult result;
        try {
            result = processRunner.run(Arrays.asList(
                "certbot", "--nginx",
                "-d", domain,
                "--non-interactive",
                "--agree-tos",
                "--email", email,
                "--redirect",
                "--keep-until-expiring"), null);
        } catch (ProcessExecutionException e) {
            throw new CertificateIssueException("证书申请失败: " + domain + " - " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new CertificateIssueException("证书申请失败: " + domain + "\n" + result.tail(10));
        }
        log.info("证书已安装: {}", domain);
    }
    
    @Override
    public void renew(String domain) {
        CommandResult result;
        try {
            result = processRunner.run("certbot", "renew", "--cert-name", domain);
        } catch (ProcessExecutionException e) {
            throw new CertificateIssueException("证书续期失败: " + domain + " - " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new CertificateIssueException("证书续期失败: " + domain + "\n" + result.tail(10));
        }
        log.info("证书已续期: {}", domain);
    }
}
