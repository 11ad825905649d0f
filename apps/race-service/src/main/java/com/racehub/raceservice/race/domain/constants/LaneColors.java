package com.racehub.raceservice.race.domain.constants;

import java.util.List;

/**
 * 赛道颜色，按赛道号（从 1 开始）取色。
 */
public final class LaneColors {

    private static final List<String> COLORS = List.of("yellow", "orange", "blue", "green", "pink");

    private LaneColors() {}

    public static String of(int lane) {
        if (lane < 1) {
            throw new IllegalArgumentException("lane must start at 1: " + lane);
        }
        return COLORS.get((lane - 1) % COLORS.size());
    }
}
