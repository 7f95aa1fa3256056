package org.gamehost.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.gamehost.exception.AuthorizationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 从令牌解析用户身份，REST 与 WebSocket 共用
 */
@Slf4j
@Component
public class TokenAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;

    public TokenAuthenticator(JwtTokenService jwtTokenService) {
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * 校验令牌并返回用户ID
     */
    public String resolveUserId(String token) {
        if (!StringUtils.hasText(token)) {
            throw new AuthorizationException(AuthorizationException.ERROR_CODE_AUTHENTICATION_FAILED, "缺少访问令牌");
        }
        try {
            Claims claims = jwtTokenService.validateToken(token);
            if (!StringUtils.hasText(claims.getSubject())) {
                throw new AuthorizationException(AuthorizationException.ERROR_CODE_AUTHENTICATION_FAILED, "令牌缺少用户信息");
            }
            return claims.getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("令牌校验失败: {}", e.getMessage());
            throw new AuthorizationException(AuthorizationException.ERROR_CODE_AUTHENTICATION_FAILED, "令牌无效或已过期", e);
        }
    }

    /**
     * 解析 Authorization 头中的用户ID
     */
    public String resolveFromHeader(String authorization) {
        return resolveUserId(extractBearer(authorization));
    }

    public static String extractBearer(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return authorization.substring(BEARER_PREFIX.length()).trim();
    }
}
