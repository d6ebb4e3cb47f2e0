package com.questhub.combatservice.common.exception;

/**
 * 引用的资源不存在（大厅、预设、实体等）
 */
public class NotFoundException extends CombatServiceException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }

    @Override
    public int httpStatus() {
        return 404;
    }
}
