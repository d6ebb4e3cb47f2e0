package com.questhub.combatservice.common.exception;

/**
 * 会话内指令被拒绝（非当前回合、非本人棋子等）。
 * 只会以 error 事件的形式回给发出指令的连接，code 由抛出方指定。
 */
public class CommandRejectedException extends CombatServiceException {

    private final String code;

    public CommandRejectedException(String code, String message) {
        super(message);
        this.code = code;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public int httpStatus() {
        return 409;
    }
}
