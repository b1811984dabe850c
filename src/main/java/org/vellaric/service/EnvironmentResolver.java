package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 计算容器最终环境变量：
 * 仓库 .env 默认值 < 持久化的项目分支变量 < 部署注入的保留变量
 */
@Slf4j
@Component
public class EnvironmentResolver {
    
    public static final String DEPLOY_BRANCH = "DEPLOY_BRANCH";
    
    public static final String DEPLOY_COMMIT = "DEPLOY_COMMIT";
    
    public static final String DEPLOY_DOMAIN = "DEPLOY_DOMAIN";
    
    public static final List<String> RESERVED_KEYS =
        Collections.unmodifiableList(Arrays.asList(DEPLOY_BRANCH, DEPLOY_COMMIT, DEPLOY_DOMAIN));
    
    private static final List<String> SECRET_MARKERS = Arrays.asList("secret", "password", "key", "token");
    
    public Map<String, String> resolve(Map<String, String> sourceDefaults,
                                       Map<String, String> persisted,
                                       String branch,
                                       String commit,
                                       String domain) {
        Map<String, String> effective = new LinkedHashMap<>();
        if (sourceDefaults != null) {
            effective.putAll(sourceDefaults);
        }
        if (persisted != null) {
            effective.putAll(persisted);
        }
        for (String reserved : RESERVED_KEYS) {
            if (effective.containsKey(reserved)) {
                log.warn("环境变量 {} 为保留变量，用户设置的值被忽略", reserved);
            }
        }
        effective.put(DEPLOY_BRANCH, branch == null ? "" : branch);
        effective.put(DEPLOY_COMMIT, commit == null ? "" : commit);
        effective.put(DEPLOY_DOMAIN, domain == null ? "" : domain);
        return effective;
    }
    
    /**
     * 日志输出用，名称中含 secret/password/key/token 的变量打码
     */
    public static Map<String, String> masked(Map<String, String> env) {
        Map<String, String> masked = new LinkedHashMap<>();
        env.forEach((key, value) -> masked.put(key, isSecretKey(key) ? "***" : value));
        return masked;
    }
    
    static boolean isSecretKey(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SECRET_MARKERS.stream().anyMatch(lower::contains);
    }
}
