package org.vellaric.service;

import org.springframework.stereotype.Component;
import org.vellaric.config.NetworkProperties;

import java.util.Locale;

/**
 * 容器名、镜像名、域名与数据库容器名的派生规则
 */
@Component
public class DeploymentNaming {
    
    private final NetworkProperties networkProperties;
    
    public DeploymentNaming(NetworkProperties networkProperties) {
        this.networkProperties = networkProperties;
    }
    
    /**
     * 项目名：连续空白替换为 '-'，转小写
     */
    public static String slug(String projectName) {
        return projectName.trim().replaceAll("\\s+", "-").toLowerCase(Locale.ROOT);
    }
    
    /**
     * 分支名中的 '/' 不能出现在容器名、镜像标签和子域名里
     */
    public static String branchSegment(String branch) {
        return branch.trim().replace('/', '-');
    }
    
    /**
     * 数据库名：转小写，非 [a-z0-9] 字符替换为 '-'
     */
    public static String sanitize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }
    
    public String containerName(String projectName, String branch) {
        return slug(projectName) + "-" + branchSegment(branch);
    }
    
    public String imageTag(String projectName, String branch) {
        return slug(projectName) + ":" + branchSegment(branch);
    }
    
    /**
     * 生产分支不带后缀：api.example.com；其它分支：api-dev.example.com
     */
    public String domain(String projectName, String branch) {
        NetworkProperties.Domain domain = networkProperties.getDomain();
        StringBuilder host = new StringBuilder(slug(projectName));
        if (!domain.getUnsuffixedBranches().contains(branch)) {
            host.append('-').append(branchSegment(branch).toLowerCase(Locale.ROOT));
        }
        return host.append('.').append(domain.getBaseDomain()).toString();
    }
    
    public String databaseContainerName(String name, String environment) {
        return sanitize(name) + "-" + environment + "-postgres";
    }
    
    public String databaseHost(String containerName) {
        return containerName + ".db." + networkProperties.getDomain().getBaseDomain();
    }
}
