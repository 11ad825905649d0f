package com.racehub.raceservice.race.domain.rule;

/**
 * 模拟器输入：某条赛道当前位置。
 */
public record LaneState(String userId, int lane, int position) {
}
