package com.questhub.web.common;

import java.io.Serializable;

/**
 * 统一 HTTP 响应外壳
 *
 * @param code    业务状态码，与 HTTP 状态保持一致（200 / 400 / 401 / 403 / 404 / 409 / 500）
 * @param message 人类可读的描述，成功时固定为 "success"
 * @param data    载荷，失败时为 null
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> ok() {
        return new ApiResponse<>(200, "success", null);
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /**
     * 失败响应，code 由调用方按异常类别决定。
     */
    public static <T> ApiResponse<T> fail(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return fail(400, message);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return fail(409, message);
    }

    /** 是否成功（2xx） */
    public boolean isOk() {
        return code >= 200 && code < 300;
    }
}
