package com.minicall.common.web;

import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.domain.exception.CallForbiddenException;
import com.minicall.domain.exception.CallNotFoundException;
import com.minicall.domain.exception.CallStateConflictException;
import com.minicall.rtc.service.RtcConfigException;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理：把常见异常“翻译”为统一的 Result JSON。
 *
 * <p>HTTP 状态码仍然会设置（400/401/403/404/409/500），但响应体结构始终一致。</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getAllErrors().isEmpty()
                ? "invalid_request"
                : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    /**
     * 业务校验失败（service 层用 IllegalArgumentException 表达）。
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, messageOr(e, "bad_request")));
    }

    @ExceptionHandler(JwtException.class)
    public ResponseEntity<Result<Void>> handleJwt(JwtException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Result.fail(ApiCodes.UNAUTHORIZED, messageOr(e, "invalid_token")));
    }

    @ExceptionHandler(CallForbiddenException.class)
    public ResponseEntity<Result<Void>> handleForbidden(CallForbiddenException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Result.fail(ApiCodes.FORBIDDEN, messageOr(e, "forbidden")));
    }

    @ExceptionHandler(CallNotFoundException.class)
    public ResponseEntity<Result<Void>> handleNotFound(CallNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Result.fail(ApiCodes.NOT_FOUND, messageOr(e, "not_found")));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Result.fail(ApiCodes.NOT_FOUND, "not_found"));
    }

    @ExceptionHandler(CallStateConflictException.class)
    public ResponseEntity<Result<Void>> handleConflict(CallStateConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Result.fail(ApiCodes.CONFLICT, messageOr(e, "conflict")));
    }

    /**
     * 缺少签名配置属于部署问题：记 error，返回固定文案，不把配置细节暴露给客户端。
     */
    @ExceptionHandler(RtcConfigException.class)
    public ResponseEntity<Result<Void>> handleRtcConfig(RtcConfigException e) {
        log.error("rtc token issuer misconfigured: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.SERVER_CONFIG_ERROR, "server_config_error"));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }

    private static String messageOr(Exception e, String fallback) {
        return (e.getMessage() == null || e.getMessage().isBlank()) ? fallback : e.getMessage();
    }
}
