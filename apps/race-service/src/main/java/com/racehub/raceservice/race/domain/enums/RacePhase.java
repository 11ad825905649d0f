package com.racehub.raceservice.race.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RacePhase {

    WAITING("waiting"),       // 等待首注（可加入，可下注）
    BETTING("betting"),       // 下注窗口（可加入，每人一注）
    COUNTDOWN("countdown"),   // 开跑倒计时（不收注，新加入者排队）
    RACING("racing"),         // 比赛中（加入/离开均排队到结束）
    FINISHED("finished");     // 结算展示冷却（到期回到 WAITING 或销毁）

    private final String wire;

    RacePhase(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** 本阶段是否允许下注 */
    public boolean acceptsWagers() {
        return this == WAITING || this == BETTING;
    }

    /** 本阶段新加入者是否需要排队到下一轮 */
    public boolean queuesJoins() {
        return this == COUNTDOWN || this == RACING;
    }
}
