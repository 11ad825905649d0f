package com.racehub.raceservice.race.domain.model;

/**
 * 已鉴权的玩家身份（握手时从 JWT 解析）。
 */
public record PlayerIdentity(String userId, String username) {
}
