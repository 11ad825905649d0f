package com.racehub.raceservice.race.domain.model;

/**
 * 终局排名中的一行，rank 从 1 开始。
 */
public record RankedEntrant(String userId, String username, int lane, String color, int position, int rank) {
}
