package com.questhub.web.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Optional;

/**
 * 当前用户提取工具
 * <p>
 * HTTP 控制器通过 {@code @AuthenticationPrincipal Jwt} 拿到令牌后，用本类统一取出用户 ID 与展示信息，
 * WebSocket 握手阶段同样复用（令牌由 query 参数携带、经 JwtDecoder 解码之后）。
 */
@Slf4j
public final class CurrentUserHelper {

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return 解析结果；jwt 为 null 时返回 null
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        String userId = jwt.getSubject();
        String handle = Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                .filter(s -> !s.isBlank())
                .orElse(userId);
        String displayName = Optional.ofNullable(jwt.getClaimAsString("name"))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .orElse(null);
        return new CurrentUserInfo(userId, handle, displayName);
    }

    /**
     * 取用户 ID；令牌缺失或没有 subject 时抛出 IllegalArgumentException（映射为 400）。
     */
    public static String requireUserId(Jwt jwt) {
        String userId = jwt != null ? jwt.getSubject() : null;
        if (userId == null || userId.isBlank()) {
            log.debug("令牌中缺少 subject，拒绝请求");
            throw new IllegalArgumentException("Access token carries no subject");
        }
        return userId;
    }
}
