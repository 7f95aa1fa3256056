package org.gamehost.controller;

import lombok.extern.slf4j.Slf4j;
import org.gamehost.dto.ApiResponse;
import org.gamehost.exception.AuthorizationException;
import org.gamehost.exception.ContainerException;
import org.gamehost.exception.GameHostException;
import org.gamehost.exception.InstanceNotFoundException;
import org.gamehost.exception.LifecycleConflictException;
import org.gamehost.exception.PortException;
import org.gamehost.exception.RuntimeUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * 全局异常处理器
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {
    
    /**
     * 处理实例不存在异常
     */
    @ExceptionHandler(InstanceNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleInstanceNotFoundException(InstanceNotFoundException e) {
        log.warn("实例不存在: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }
    
    /**
     * 处理认证与归属校验异常
     */
    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ApiResponse<Object>> handleAuthorizationException(AuthorizationException e) {
        log.warn("访问被拒绝: {}", e.getMessage());
        HttpStatus status = e.isAuthenticationFailure() ? HttpStatus.UNAUTHORIZED : HttpStatus.FORBIDDEN;
        return build(status, e.getErrorCode(), e.getMessage());
    }
    
    /**
     * 处理并发生命周期操作冲突
     */
    @ExceptionHandler(LifecycleConflictException.class)
    public ResponseEntity<ApiResponse<Object>> handleLifecycleConflictException(LifecycleConflictException e) {
        log.warn("操作冲突: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }
    
    /**
     * 处理容器运行时不可达
     */
    @ExceptionHandler(RuntimeUnavailableException.class)
    public ResponseEntity<ApiResponse<Object>> handleRuntimeUnavailableException(RuntimeUnavailableException e) {
        log.error("容器运行时不可用: {}", e.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage());
    }
    
    /**
     * 处理容器操作异常
     */
    @ExceptionHandler(ContainerException.class)
    public ResponseEntity<ApiResponse<Object>> handleContainerException(ContainerException e) {
        if (ContainerException.ERROR_CODE_INVALID_STATE.equals(e.getErrorCode())) {
            log.warn("实例状态不允许该操作: {}", e.getMessage());
            return build(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
        }
        log.error("容器操作失败: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR,
            e.getErrorCode() != null ? e.getErrorCode() : ContainerException.ERROR_CODE_START_FAILED, e.getMessage());
    }
    
    /**
     * 处理端口管理异常
     */
    @ExceptionHandler(PortException.class)
    public ResponseEntity<ApiResponse<Object>> handlePortException(PortException e) {
        if (PortException.ERROR_CODE_PORTS_EXHAUSTED.equals(e.getErrorCode())) {
            log.warn("端口已耗尽: {}", e.getMessage());
            return build(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage());
        }
        if (PortException.ERROR_CODE_INVALID_RANGE.equals(e.getErrorCode())) {
            return build(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
        }
        log.error("端口操作失败: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage());
    }
    
    /**
     * 处理通用托管异常
     */
    @ExceptionHandler(GameHostException.class)
    public ResponseEntity<ApiResponse<Object>> handleGameHostException(GameHostException e) {
        log.error("实例操作失败: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR,
            e.getErrorCode() != null ? e.getErrorCode() : "INSTANCE_OPERATION_FAILED", e.getMessage());
    }
    
    /**
     * 处理参数校验失败
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("请求参数无效: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }
    
    /**
     * 处理其他未捕获的异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleException(Exception e) {
        log.error("未处理的异常: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "系统内部错误: " + e.getMessage());
    }
    
    private static ResponseEntity<ApiResponse<Object>> build(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(errorCode, message));
    }
}
