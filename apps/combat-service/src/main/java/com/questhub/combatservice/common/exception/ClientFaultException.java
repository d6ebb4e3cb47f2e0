package com.questhub.combatservice.common.exception;

/**
 * 客户端请求不合法（参数错误、预设冲突等）
 */
public class ClientFaultException extends CombatServiceException {

    public ClientFaultException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "CLIENT_FAULT";
    }

    @Override
    public int httpStatus() {
        return 400;
    }
}
