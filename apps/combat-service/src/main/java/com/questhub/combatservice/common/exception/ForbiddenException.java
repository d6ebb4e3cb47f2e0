package com.questhub.combatservice.common.exception;

/**
 * 身份有效但无权执行该操作（非 GM、非棋子控制者等）
 */
public class ForbiddenException extends CombatServiceException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "FORBIDDEN";
    }

    @Override
    public int httpStatus() {
        return 403;
    }
}
