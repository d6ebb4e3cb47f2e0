package com.questhub.combatservice.common.exception;

/**
 * 内部错误（存储写入失败等）。对外只返回固定文案，原因仅记日志。
 */
public class InternalFaultException extends CombatServiceException {

    public static final String PUBLIC_MESSAGE = "Internal server error";

    public InternalFaultException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "INTERNAL_FAULT";
    }

    @Override
    public int httpStatus() {
        return 500;
    }
}
