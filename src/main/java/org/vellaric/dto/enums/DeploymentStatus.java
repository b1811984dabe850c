package org.vellaric.dto.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 部署状态
 */
public enum DeploymentStatus {
    
    QUEUED("queued"),
    BUILDING("building"),
    SUCCESS("success"),
    FAILED("failed");
    
    @EnumValue
    private final String value;
    
    DeploymentStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
