package org.vellaric.dto;

import java.util.Locale;

/**
 * (项目, 分支) 组合键
 */
public final class DeploymentKeys {
    
    private DeploymentKeys() {
    }
    
    public static String pairKey(String projectName, String branch) {
        return projectName.trim().toLowerCase(Locale.ROOT) + "@" + branch;
    }
}
