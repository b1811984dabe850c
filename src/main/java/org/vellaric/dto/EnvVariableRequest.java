package org.vellaric.dto;

import lombok.Data;

/**
 * 保存环境变量请求
 */
@Data
public class EnvVariableRequest {
    
    private String projectName;
    
    private String branch;
    
    private String key;
    
    private String value;
    
    private boolean secret;
    
    private String description;
}
