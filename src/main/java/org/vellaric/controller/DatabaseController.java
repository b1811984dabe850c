package org.vellaric.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.vellaric.dto.ApiResponse;
import org.vellaric.dto.CreateDatabaseRequest;
import org.vellaric.dto.DatabaseCredentials;
import org.vellaric.dto.DatabaseInfo;
import org.vellaric.dto.DatabaseStats;
import org.vellaric.service.DatabaseManagerService;

import java.util.List;

/**
 * 托管数据库 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/databases")
public class DatabaseController {
    
    @Autowired
    private DatabaseManagerService databaseManagerService;
    
    /**
     * 创建数据库，响应中的密码只返回这一次
     * POST /api/databases
     */
    @PostMapping
    public ResponseEntity<ApiResponse<DatabaseCredentials>> create(@RequestBody CreateDatabaseRequest request) {
        log.info("创建数据库请求: name={}, environment={}", request.getName(), request.getEnvironment());
        DatabaseCredentials credentials = databaseManagerService.createInstance(request.getName(), request.getEnvironment());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.success(credentials, "数据库创建成功，请妥善保存密码"));
    }
    
    @GetMapping
    public ResponseEntity<ApiResponse<List<DatabaseInfo>>> list() {
        return ResponseEntity.ok(ApiResponse.success(databaseManagerService.listDatabases()));
    }
    
    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DatabaseInfo>> get(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(databaseManagerService.getDatabase(id)));
    }
    
    @GetMapping("/{id}/stats")
    public ResponseEntity<ApiResponse<DatabaseStats>> stats(@PathVariable String id) {
        return ResponseEntity.ok(ApiResponse.success(databaseManagerService.stats(id)));
    }
    
    @PostMapping("/{id}/start")
    public ResponseEntity<ApiResponse<DatabaseInfo>> start(@PathVariable String id) {
        log.info("启动数据库: {}", id);
        return ResponseEntity.ok(ApiResponse.success(databaseManagerService.startDatabase(id), "数据库已启动"));
    }
    
    @PostMapping("/{id}/stop")
    public ResponseEntity<ApiResponse<DatabaseInfo>> stop(@PathVariable String id) {
        log.info("停止数据库: {}", id);
        return ResponseEntity.ok(ApiResponse.success(databaseManagerService.stopDatabase(id), "数据库已停止"));
    }
    
    @PostMapping("/{id}/restart")
    public ResponseEntity<ApiResponse<DatabaseInfo>> restart(@PathVariable String id) {
        log.info("重启数据库: {}", id);
        return ResponseEntity.ok(ApiResponse.success(databaseManagerService.restartDatabase(id), "数据库已重启"));
    }
    
    /**
     * 删除数据库，purgeStorage=true 时同时删除数据目录
     * DELETE /api/databases/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Object>> delete(@PathVariable String id,
                                                      @RequestParam(defaultValue = "false") boolean purgeStorage) {
        log.info("删除数据库: id={}, purgeStorage={}", id, purgeStorage);
        databaseManagerService.deleteDatabase(id, purgeStorage);
        return ResponseEntity.ok(ApiResponse.success(null, "数据库已删除"));
    }
}
