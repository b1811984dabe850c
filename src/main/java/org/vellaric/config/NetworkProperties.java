package org.vellaric.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 域名、反向代理、证书与 DNS 配置 platform.*
 */
@Data
@Component
@ConfigurationProperties(prefix = "platform")
public class NetworkProperties {
    
    private Domain domain = new Domain();
    
    private Network network = new Network();
    
    private Nginx nginx = new Nginx();
    
    private Ssl ssl = new Ssl();
    
    private Dns dns = new Dns();
    
    @Data
    public static class Domain {
        
        private String baseDomain = "localhost";
        
        /**
         * 不加分支后缀的分支（生产分支）
         */
        private List<String> unsuffixedBranches = new ArrayList<>(Arrays.asList("main", "master"));
    }
    
    @Data
    public static class Network {
        
        /**
         * 本机公网 IP，为空时通过 ip-lookup-url 查询
         */
        private String publicIp;
        
        private String ipLookupUrl = "https://api.ipify.org?format=json";
    }
    
    @Data
    public static class Nginx {
        
        private String sitesAvailable = "/etc/nginx/sites-available";
        
        private String sitesEnabled = "/etc/nginx/sites-enabled";
        
        private List<String> testCommand = new ArrayList<>(Arrays.asList("nginx", "-t"));
        
        private List<String> reloadCommand = new ArrayList<>(Arrays.asList("systemctl", "reload", "nginx"));
    }
    
    @Data
    public static class Ssl {
        
        private boolean enabled = true;
        
        private String email;
        
        private String liveDir = "/etc/letsencrypt/live";
    }
    
    @Data
    public static class Dns {
        
        /**
         * 用于检查公网解析的 DNS 服务器
         */
        private String resolver = "8.8.8.8";
        
        private Duration propagationInterval = Duration.ofSeconds(1);
        
        private int propagationMaxAttempts = 30;
        
        private Cloudflare cloudflare = new Cloudflare();
    }
    
    @Data
    public static class Cloudflare {
        
        private String apiToken;
        
        private String apiBase = "https://api.cloudflare.com/client/v4";
        
        public boolean isConfigured() {
            return apiToken != null && !apiToken.trim().isEmpty();
        }
    }
}
