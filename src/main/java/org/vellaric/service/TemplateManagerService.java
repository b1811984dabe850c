package org.vellaric.service;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * 模板管理服务
 */
@Slf4j
@Service
public class TemplateManagerService {
    
    static final String NGINX_SITE_TEMPLATE = "templates/nginx-site.mustache";
    
    @Value("${platform.nginx.client-max-body-size:50m}")
    private String clientMaxBodySize = "50m";
    
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    
    /**
     * 渲染反向代理站点配置：域名 -> 127.0.0.1:port
     */
    public String renderNginxSite(String domain, int port, String containerName) {
        Mustache mustache = mustacheFactory.compile(NGINX_SITE_TEMPLATE);
        
        Map<String, Object> context = new HashMap<>();
        context.put("domain", domain);
        context.put("port", port);
        context.put("containerName", containerName);
        context.put("clientMaxBodySize", clientMaxBodySize);
        
        StringWriter writer = new StringWriter();
        mustache.execute(writer, context);
        log.debug("渲染 nginx 配置: {} -> {}", domain, port);
        return writer.toString();
    }
}
