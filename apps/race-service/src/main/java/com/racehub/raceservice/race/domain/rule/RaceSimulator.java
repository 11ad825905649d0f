package com.racehub.raceservice.race.domain.rule;

import com.racehub.raceservice.race.domain.model.RaceEntrant;
import com.racehub.raceservice.race.domain.model.RankedEntrant;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * 比赛模拟器（纯函数，给定随机源即完全确定）。
 *
 * 规则：
 *  1. 每帧为每条未到终点的赛道抽取 [advanceMin, advanceMax] 的随机步长，位置截断到 trackLength；
 *  2. 任一赛道首次到达 trackLength 的那一帧比赛结束；
 *  3. 同帧多人到达：本帧步长大者在前，再按赛道号小者在前；
 *  4. 领先者：位置最高，同位置取赛道号小者。
 */
public class RaceSimulator {

    private final int trackLength;
    private final int advanceMin;
    private final int advanceMax;

    public RaceSimulator(int trackLength, int advanceMin, int advanceMax) {
        if (trackLength <= 0 || advanceMin <= 0 || advanceMax < advanceMin) {
            throw new IllegalArgumentException("invalid race config: track=" + trackLength
                    + ", advance=[" + advanceMin + "," + advanceMax + "]");
        }
        this.trackLength = trackLength;
        this.advanceMin = advanceMin;
        this.advanceMax = advanceMax;
    }

    public int trackLength() {
        return trackLength;
    }

    /**
     * 推进一帧。
     * @param lanes  当前各赛道状态
     * @param random 随机源
     * @return 推进后的状态
     */
    public TickResult tick(List<LaneState> lanes, RandomGenerator random) {
        List<LaneState> ordered = new ArrayList<>(lanes);
        ordered.sort(Comparator.comparingInt(LaneState::lane));

        List<LaneState> next = new ArrayList<>(ordered.size());
        Map<String, Integer> advances = new LinkedHashMap<>();
        List<LaneState> arrived = new ArrayList<>();
        for (LaneState lane : ordered) {
            // 已到终点的赛道不再抽步长
            if (lane.position() >= trackLength) {
                next.add(lane);
                continue;
            }
            int advance = random.nextInt(advanceMin, advanceMax + 1);
            int position = Math.min(trackLength, lane.position() + advance);
            LaneState moved = new LaneState(lane.userId(), lane.lane(), position);
            advances.put(lane.userId(), advance);
            next.add(moved);
            if (position >= trackLength) {
                arrived.add(moved);
            }
        }

        arrived.sort(Comparator.<LaneState>comparingInt(l -> advances.get(l.userId())).reversed()
                .thenComparingInt(LaneState::lane));
        List<String> finishers = arrived.stream().map(LaneState::userId).toList();

        return new TickResult(List.copyOf(next), advances, leaderOf(next), finishers);
    }

    /**
     * 终局排名：本帧到达者按平局规则在前，其余按位置降序、赛道号升序。
     * @param entrants  参赛者
     * @param finalLanes 最后一帧的赛道状态
     * @param finishers  最后一帧的到达顺序
     */
    public List<RankedEntrant> rank(List<RaceEntrant> entrants, List<LaneState> finalLanes, List<String> finishers) {
        Map<String, Integer> positions = new HashMap<>();
        for (LaneState l : finalLanes) {
            positions.put(l.userId(), l.position());
        }
        List<RaceEntrant> rest = new ArrayList<>();
        Map<String, RaceEntrant> byId = new HashMap<>();
        for (RaceEntrant e : entrants) {
            byId.put(e.userId(), e);
            if (!finishers.contains(e.userId())) {
                rest.add(e);
            }
        }
        rest.sort(Comparator.<RaceEntrant>comparingInt(e -> positions.getOrDefault(e.userId(), 0)).reversed()
                .thenComparingInt(RaceEntrant::lane));

        List<RankedEntrant> ranking = new ArrayList<>(entrants.size());
        int rank = 1;
        for (String userId : finishers) {
            RaceEntrant e = byId.get(userId);
            ranking.add(new RankedEntrant(e.userId(), e.username(), e.lane(), e.color(),
                    positions.getOrDefault(userId, 0), rank++));
        }
        for (RaceEntrant e : rest) {
            ranking.add(new RankedEntrant(e.userId(), e.username(), e.lane(), e.color(),
                    positions.getOrDefault(e.userId(), 0), rank++));
        }
        return ranking;
    }

    private static String leaderOf(List<LaneState> lanes) {
        LaneState leader = null;
        for (LaneState l : lanes) {
            // lanes 已按赛道号升序，严格大于才替换即可保证同位置取小赛道号
            if (leader == null || l.position() > leader.position()) {
                leader = l;
            }
        }
        return leader == null ? null : leader.userId();
    }
}
