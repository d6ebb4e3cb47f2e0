package com.questhub.combatservice.infrastructure.auth;

import com.questhub.combatservice.common.exception.UnauthorizedException;
import com.questhub.combatservice.platform.auth.AccessTokenVerifier;
import com.questhub.combatservice.platform.auth.VerifiedToken;
import com.questhub.web.common.CurrentUserHelper;
import com.questhub.web.common.CurrentUserInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * 基于 JwtDecoder 的令牌校验（与 HTTP 资源服务器共用同一个解码器与签发方配置）。
 * 兼容带 "Bearer " 前缀的令牌。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAccessTokenVerifier implements AccessTokenVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtDecoder jwtDecoder;

    @Override
    public VerifiedToken verify(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new UnauthorizedException("Missing access token");
        }
        String raw = accessToken.startsWith(BEARER_PREFIX) ? accessToken.substring(BEARER_PREFIX.length()) : accessToken;
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(raw.trim());
        } catch (JwtException e) {
            log.debug("JWT 解码失败: {}", e.getMessage());
            throw new UnauthorizedException("Invalid access token");
        }
        CurrentUserInfo user = CurrentUserHelper.from(jwt);
        if (user == null || user.userId() == null || user.userId().isBlank()) {
            throw new UnauthorizedException("Access token carries no subject");
        }
        return new VerifiedToken(user.userId(), user.handle());
    }
}
