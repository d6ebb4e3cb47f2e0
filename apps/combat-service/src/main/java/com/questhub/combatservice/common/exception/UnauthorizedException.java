package com.questhub.combatservice.common.exception;

/**
 * 访问令牌无效或缺失
 */
public class UnauthorizedException extends CombatServiceException {

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "UNAUTHORIZED";
    }

    @Override
    public int httpStatus() {
        return 401;
    }
}
