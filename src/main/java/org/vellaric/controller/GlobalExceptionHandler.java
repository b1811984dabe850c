package org.vellaric.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.vellaric.dto.ApiResponse;
import org.vellaric.exception.DatabaseNotFoundException;
import org.vellaric.exception.DeploymentException;
import org.vellaric.exception.DeploymentNotFoundException;
import org.vellaric.exception.DuplicateDatabaseException;
import org.vellaric.exception.InvalidRequestException;
import org.vellaric.exception.PlatformException;

/**
 * 全局异常处理器
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {
    
    /**
     * 处理部署记录不存在异常
     */
    @ExceptionHandler(DeploymentNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleDeploymentNotFoundException(DeploymentNotFoundException e) {
        log.warn("部署记录不存在: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ApiResponse.error(DeploymentNotFoundException.ERROR_CODE, e.getMessage()));
    }
    
    /**
     * 处理数据库实例不存在异常
     */
    @ExceptionHandler(DatabaseNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleDatabaseNotFoundException(DatabaseNotFoundException e) {
        log.warn("数据库实例不存在: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ApiResponse.error(DatabaseNotFoundException.ERROR_CODE, e.getMessage()));
    }
    
    @ExceptionHandler(DuplicateDatabaseException.class)
    public ResponseEntity<ApiResponse<Object>> handleDuplicateDatabaseException(DuplicateDatabaseException e) {
        log.warn("数据库重复创建: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(ApiResponse.error(DuplicateDatabaseException.ERROR_CODE, e.getMessage()));
    }
    
    /**
     * 处理请求参数错误
     */
    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiResponse<Object>> handleInvalidRequestException(InvalidRequestException e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(InvalidRequestException.ERROR_CODE, e.getMessage()));
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("请求体无法解析: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(InvalidRequestException.ERROR_CODE, "请求体格式错误"));
    }
    
    /**
     * 处理部署异常，部署进行中时返回 409
     */
    @ExceptionHandler(DeploymentException.class)
    public ResponseEntity<ApiResponse<Object>> handleDeploymentException(DeploymentException e) {
        if (DeploymentException.ERROR_CODE_IN_PROGRESS.equals(e.getErrorCode())) {
            log.warn("部署进行中: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(e.getErrorCode(), e.getMessage()));
        }
        log.error("部署操作失败: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error(e.getErrorCode() != null ? e.getErrorCode() : "DEPLOYMENT_FAILED", e.getMessage()));
    }
    
    /**
     * 处理平台通用异常
     */
    @ExceptionHandler(PlatformException.class)
    public ResponseEntity<ApiResponse<Object>> handlePlatformException(PlatformException e) {
        log.error("平台操作失败: {}", e.getMessage(), e);
        ApiResponse<Object> response = ApiResponse.error(
            e.getErrorCode() != null ? e.getErrorCode() : "PLATFORM_OPERATION_FAILED",
            e.getMessage()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    /**
     * 处理其他未捕获的异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleException(Exception e) {
        log.error("未处理的异常: {}", e.getMessage(), e);
        ApiResponse<Object> response = ApiResponse.error(
            "INTERNAL_SERVER_ERROR",
            "系统内部错误: " + e.getMessage()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
