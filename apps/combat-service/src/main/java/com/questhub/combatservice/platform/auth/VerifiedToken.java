package com.questhub.combatservice.platform.auth;

/**
 * 令牌校验结果
 *
 * @param subjectId 令牌主体，即玩家的用户 ID
 * @param handle    登录名，可能为 null
 */
public record VerifiedToken(String subjectId, String handle) {
}
