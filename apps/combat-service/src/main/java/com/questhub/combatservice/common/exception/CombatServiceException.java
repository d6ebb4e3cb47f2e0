package com.questhub.combatservice.common.exception;

/**
 * 业务异常基类。
 * 子类对应错误分类（客户端错误 / 未找到 / 未认证 / 无权限 / 内部错误），
 * 由 {@link com.questhub.combatservice.common.WebExceptionAdvice} 统一映射为 HTTP 状态码，
 * 在 WebSocket 会话内则转为发往出错连接的 error 事件。
 */
public abstract class CombatServiceException extends RuntimeException {

    protected CombatServiceException(String message) {
        super(message);
    }

    protected CombatServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 对外错误码，写入 error 事件的 code 字段 */
    public abstract String code();

    /** 对应的 HTTP 状态码 */
    public abstract int httpStatus();
}
