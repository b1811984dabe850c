package org.vellaric.dto.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 数据库实例状态
 */
public enum DatabaseStatus {
    
    ACTIVE("active"),
    STOPPED("stopped");
    
    @EnumValue
    private final String value;
    
    DatabaseStatus(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
