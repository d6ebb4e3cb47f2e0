package com.questhub.combatservice.common;

import com.questhub.combatservice.common.exception.CombatServiceException;
import com.questhub.combatservice.common.exception.InternalFaultException;
import com.questhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 业务异常：按子类声明的状态码返回。
     * 内部错误只返回固定文案，细节落日志。
     */
    @ExceptionHandler(CombatServiceException.class)
    public ResponseEntity<ApiResponse<Object>> business(CombatServiceException e) {
        if (e instanceof InternalFaultException) {
            log.error("内部错误: {}", e.getMessage(), e);
            return ResponseEntity.status(e.httpStatus())
                    .body(ApiResponse.fail(e.httpStatus(), InternalFaultException.PUBLIC_MESSAGE));
        }
        log.debug("业务异常: code={}, message={}", e.code(), e.getMessage());
        return ResponseEntity.status(e.httpStatus()).body(ApiResponse.fail(e.httpStatus(), e.getMessage()));
    }

    /**
     * 请求体校验失败（@Valid），取第一条字段错误作为提示。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .orElse("Invalid request body");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(msg));
    }

    /**
     * 参数不合法（IllegalArgumentException）→ 400
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 状态冲突（IllegalStateException）→ 409
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
