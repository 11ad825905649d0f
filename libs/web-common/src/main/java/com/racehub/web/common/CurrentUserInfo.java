package com.racehub.web.common;

/**
 * 从 JWT 中解析出的当前用户。
 *
 * @param userId   用户ID（JWT subject）
 * @param username 登录名（preferred_username，缺省时等于 userId）
 * @param nickname 昵称（name 去掉占位姓氏后的值，可能为 null）
 */
public record CurrentUserInfo(String userId, String username, String nickname) {

    /**
     * 展示名称：nickname > username > userId
     */
    public String getDisplayName() {
        if (nickname != null && !nickname.isBlank()) {
            return nickname;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }
}
