package com.racehub.web.common;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Optional;

/**
 * 当前用户信息提取工具类。
 * <p>
 * HTTP 接口通过 {@code @AuthenticationPrincipal Jwt} 拿到令牌，WebSocket 握手阶段由拦截器自行解码，
 * 两处都用这里把 claim 统一转换成 {@link CurrentUserInfo}。
 */
public final class CurrentUserHelper {

    /** Keycloak 必填 lastName 的占位值，展示时去掉 */
    private static final String LASTNAME_PLACEHOLDER = "-";

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param jwt 已验签的令牌
     * @return 当前用户，jwt 为 null 或缺少 subject 时返回 null
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null || jwt.getSubject() == null || jwt.getSubject().isBlank()) {
            return null;
        }
        String userId = jwt.getSubject();
        String username = Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                .filter(s -> !s.isBlank())
                .orElse(userId);
        String nickname = Optional.ofNullable(jwt.getClaimAsString("name"))
                .map(CurrentUserHelper::cleanName)
                .filter(s -> !s.isBlank())
                .orElse(null);
        return new CurrentUserInfo(userId, username, nickname);
    }

    public static String getUserId(Jwt jwt) {
        return jwt != null ? jwt.getSubject() : null;
    }

    /**
     * 去掉 name 末尾的占位姓氏，例如 "张三 -" → "张三"，名字中间的横线保留。
     */
    static String cleanName(String name) {
        if (name == null || name.isBlank()) {
            return name;
        }
        String result = name.trim();
        if (result.endsWith(" " + LASTNAME_PLACEHOLDER)) {
            result = result.substring(0, result.length() - 2);
        } else if (result.endsWith(LASTNAME_PLACEHOLDER)) {
            result = result.substring(0, result.length() - 1);
        }
        return result.trim();
    }
}
