package org.vellaric.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 统一 API 响应。失败时 errorCode 为异常的错误码，data 省略
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private String message;
    private String errorCode;
    private LocalDateTime timestamp;

    public static <T> ApiResponse<T> success(T data) {
        return success(data, "操作成功");
    }

    public static <T> ApiResponse<T> success(T data, String message) {
        ApiResponse<T> response = of(true, message);
        response.setData(data);
        return response;
    }

    public static <T> ApiResponse<T> error(String errorCode, String message) {
        ApiResponse<T> response = of(false, message);
        response.setErrorCode(errorCode);
        return response;
    }

    private static <T> ApiResponse<T> of(boolean success, String message) {
        ApiResponse<T> response = new ApiResponse<>();
        response.setSuccess(success);
        response.setMessage(message);
        response.setTimestamp(LocalDateTime.now());
        return response;
    }
}
