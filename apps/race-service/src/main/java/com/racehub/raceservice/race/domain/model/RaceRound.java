package com.racehub.raceservice.race.domain.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * RaceRound
 * ---------------------------------------
 * 一场比赛的记录：开跑时创建（参赛者与奖池快照），逐帧追加位移，
 * 进入 FINISHED 时封存（seal），封存后不可再修改，下一场比赛使用新的对象。
 */
@Getter
public class RaceRound {

    private final String roundId;
    private final String roomId;
    private final List<RaceEntrant> entrants;
    private final long pot;
    private final long startedAtEpochMs;

    private final List<Map<String, Integer>> tickAdvances = new ArrayList<>();
    private boolean sealed;
    private String winnerId;
    private List<RankedEntrant> ranking = List.of();

    public RaceRound(String roundId, String roomId, List<RaceEntrant> entrants, long startedAtEpochMs) {
        this.roundId = Objects.requireNonNull(roundId, "roundId");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.entrants = List.copyOf(entrants);
        this.pot = entrants.stream().mapToLong(RaceEntrant::wager).sum();
        this.startedAtEpochMs = startedAtEpochMs;
    }

    /**
     * 追加一帧的位移（userId -> 本帧前进步长）。
     */
    public void recordTick(Map<String, Integer> advances) {
        ensureOpen();
        tickAdvances.add(Map.copyOf(advances));
    }

    /**
     * 封存比赛结果。
     */
    public void seal(String winnerId, List<RankedEntrant> ranking) {
        ensureOpen();
        if (ranking.isEmpty() || !ranking.get(0).userId().equals(winnerId)) {
            throw new IllegalStateException("winner must be ranked first: " + winnerId);
        }
        this.winnerId = winnerId;
        this.ranking = List.copyOf(ranking);
        this.sealed = true;
    }

    public List<Map<String, Integer>> getTickAdvances() {
        return Collections.unmodifiableList(tickAdvances);
    }

    public int tickCount() {
        return tickAdvances.size();
    }

    public RaceEntrant entrant(String userId) {
        return entrants.stream().filter(e -> e.userId().equals(userId)).findFirst().orElse(null);
    }

    private void ensureOpen() {
        if (sealed) {
            throw new IllegalStateException("round already sealed: " + roundId);
        }
    }
}
