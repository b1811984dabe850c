package org.vellaric.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.vellaric.config.NetworkProperties;
import org.vellaric.dto.CommandResult;
import org.vellaric.exception.ProxyConfigException;
import org.vellaric.service.ProcessRunner;
import org.vellaric.service.TemplateManagerService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * nginx 站点管理：sites-available 写配置，sites-enabled 建软链接
 */
@Slf4j
@Component
public class NginxReverseProxy implements ReverseProxy {
    
    private final NetworkProperties networkProperties;
    
    private final TemplateManagerService templateManagerService;
    
    private final ProcessRunner processRunner;
    
    public NginxReverseProxy(NetworkProperties networkProperties,
                             TemplateManagerService templateManagerService,
                             ProcessRunner processRunner) {
        this.networkProperties = networkProperties;
        this.templateManagerService = templateManagerService;
        this.processRunner = processRunner;
    }
    
    @Override
    public void writeSite(String domain, int port, String containerName) {
        Path available = availablePath(domain);
        Path enabled = enabledPath(domain);
        String content = templateManagerService.renderNginxSite(domain, port, containerName);
        
        String previous = null;
        try {
            if (Files.isRegularFile(available)) {
                previous = new String(Files.readAllBytes(available), StandardCharsets.UTF_8);
            }
            Files.createDirectories(available.getParent());
            Files.write(available, content.getBytes(StandardCharsets.UTF_8));
            if (!Files.exists(enabled, LinkOption.NOFOLLOW_LINKS)) {
                Files.createDirectories(enabled.getParent());
                Files.createSymbolicLink(enabled, available);
            }
            log.info("写入 nginx 配置: {} -> 127.0.0.1:{}", domain, port);
        } catch (IOException e) {
            throw new ProxyConfigException("写入 nginx 配置失败: " + domain, e);
        }
        
        CommandResult test = processRunner.run(networkProperties.getNginx().getTestCommand(), null);
        if (!test.isSuccess()) {
            restore(domain, previous);
            throw new ProxyConfigException("nginx 配置校验失败: " + domain + "\n" + test.tail(10));
        }
    }
    
    private void restore(String domain, String previous) {
        try {
            if (previous != null) {
                Files.write(availablePath(domain), previous.getBytes(StandardCharsets.UTF_8));
            } else {
                Files.deleteIfExists(enabledPath(domain));
                Files.deleteIfExists(availablePath(domain));
            }
        } catch (IOException e) {
            log.error("还原 nginx 配置失败: {}", domain, e);
        }
    }
    
    @Override
    public boolean siteExists(String domain) {
        return Files.isRegularFile(availablePath(domain));
    }
    
    @Override
    public void removeSite(String domain) {
        try {
            Files.deleteIfExists(enabledPath(domain));
            Files.deleteIfExists(availablePath(domain));
            log.info("删除 nginx 配置: {}", domain);
        } catch (IOException e) {
            throw new ProxyConfigException("删除 nginx 配置失败: " + domain, e);
        }
    }
    
    @Override
    public void reload() {
        CommandResult result = processRunner.run(networkProperties.getNginx().getReloadCommand(), null);
        if (!result.isSuccess()) {
            throw new ProxyConfigException("nginx 重载失败: " + result.tail(10));
        }
        log.info("nginx 已重载");
    }
    
    private Path availablePath(String domain) {
        return Paths.get(networkProperties.getNginx().getSitesAvailable(), domain);
    }
    
    private Path enabledPath(String domain) {
        return Paths.get(networkProperties.getNginx().getSitesEnabled(), domain);
    }
}
