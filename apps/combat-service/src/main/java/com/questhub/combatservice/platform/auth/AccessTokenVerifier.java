package com.questhub.combatservice.platform.auth;

import com.questhub.combatservice.common.exception.UnauthorizedException;

/**
 * 访问令牌校验（黑盒）
 */
public interface AccessTokenVerifier {

    /**
     * @throws UnauthorizedException 令牌缺失、过期、签名不符或缺少 subject
     */
    VerifiedToken verify(String accessToken);
}
