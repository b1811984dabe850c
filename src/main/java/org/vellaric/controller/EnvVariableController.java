package org.vellaric.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.vellaric.dto.ApiResponse;
import org.vellaric.dto.EnvVariableRequest;
import org.vellaric.entity.EnvVariable;
import org.vellaric.exception.InvalidRequestException;
import org.vellaric.service.EnvVariableService;

import java.util.List;

/**
 * 项目分支环境变量 REST API，敏感值在响应中打码
 */
@Slf4j
@RestController
@RequestMapping("/api/env")
public class EnvVariableController {
    
    @Autowired
    private EnvVariableService envVariableService;
    
    @GetMapping("/{projectName}/{branch}")
    public ResponseEntity<ApiResponse<List<EnvVariable>>> list(@PathVariable String projectName,
                                                               @PathVariable String branch) {
        return ResponseEntity.ok(ApiResponse.success(envVariableService.listMasked(projectName, branch)));
    }
    
    @GetMapping("/{projectName}")
    public ResponseEntity<ApiResponse<List<EnvVariable>>> listAllBranches(@PathVariable String projectName) {
        return ResponseEntity.ok(ApiResponse.success(envVariableService.listMasked(projectName, null)));
    }
    
    @PostMapping
    public ResponseEntity<ApiResponse<EnvVariable>> save(@RequestBody EnvVariableRequest request) {
        EnvVariable saved = envVariableService.save(request);
        if (Boolean.TRUE.equals(saved.getSecret())) {
            saved.setVarValue(EnvVariableService.MASK);
        }
        return ResponseEntity.ok(ApiResponse.success(saved, "环境变量已保存"));
    }
    
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Object>> delete(@PathVariable Long id) {
        if (!envVariableService.delete(id)) {
            throw new InvalidRequestException("环境变量不存在: " + id);
        }
        return ResponseEntity.ok(ApiResponse.success(null, "环境变量已删除"));
    }
}
