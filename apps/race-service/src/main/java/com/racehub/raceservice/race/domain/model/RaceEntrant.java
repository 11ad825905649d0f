package com.racehub.raceservice.race.domain.model;

/**
 * 开跑时快照下来的参赛者（只有本轮已下注的玩家）。
 */
public record RaceEntrant(String userId, String username, int lane, String color, long wager) {
}
