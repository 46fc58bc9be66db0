package com.bingohub.bingoservice.common;

import com.bingohub.realtime.error.PersistenceException;
import com.bingohub.realtime.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {
    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * 例如未知图案、未知分奖方式、声明不存在。
     * @return HTTP 400（Bad Request）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 请求体校验失败（@Valid）。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(msg));
    }

    /**
     * 处理非法状态异常（IllegalStateException）。
     * 例如会话未开启、声明不处于待判定状态。
     * @return HTTP 409（Conflict）
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 持久化失败：叫号/重置未提交，叫号方需要重试。
     * @return HTTP 503
     */
    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ApiResponse<Object>> persistence(PersistenceException e) {
        log.warn("持久化失败: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.unavailable(e.getMessage()));
    }

    /**
     * 传输不可用或等待超时。
     * @return HTTP 503
     */
    @ExceptionHandler(TransportException.class)
    public ResponseEntity<ApiResponse<Object>> transport(TransportException e) {
        log.warn("传输不可用: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.unavailable(e.getMessage()));
    }
}
