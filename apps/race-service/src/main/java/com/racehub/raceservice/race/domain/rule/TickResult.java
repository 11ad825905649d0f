package com.racehub.raceservice.race.domain.rule;

import java.util.List;
import java.util.Map;

/**
 * 一帧模拟的结果。
 *
 * @param lanes     本帧之后各赛道状态（按赛道号升序）
 * @param advances  userId -> 本帧随机步长（未截断）
 * @param leaderId  领先者（位置最高，同位置取赛道号小者）
 * @param finishers 本帧抵达终点的 userId，已按平局规则排好序
 */
public record TickResult(List<LaneState> lanes,
                         Map<String, Integer> advances,
                         String leaderId,
                         List<String> finishers) {

    public boolean finished() {
        return !finishers.isEmpty();
    }

    /** 本帧决出的冠军，未结束时为 null */
    public String winnerId() {
        return finishers.isEmpty() ? null : finishers.get(0);
    }
}
