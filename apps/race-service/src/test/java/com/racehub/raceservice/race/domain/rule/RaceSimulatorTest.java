package com.racehub.raceservice.race.domain.rule;

import com.racehub.raceservice.race.domain.constants.LaneColors;
import com.racehub.raceservice.race.domain.model.RaceEntrant;
import com.racehub.raceservice.race.domain.model.RankedEntrant;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RaceSimulatorTest {

    private final RaceSimulator simulator = new RaceSimulator(10, 1, 5);

    /** 按脚本依次给出步长 */
    private static final class ScriptedRandom implements RandomGenerator {
        private final Deque<Integer> values;

        ScriptedRandom(Integer... values) {
            this.values = new ArrayDeque<>(List.of(values));
        }

        @Override
        public int nextInt(int origin, int bound) {
            int value = values.removeFirst();
            assertThat(value).isBetween(origin, bound - 1);
            return value;
        }

        @Override
        public long nextLong() {
            throw new UnsupportedOperationException();
        }
    }

    private static LaneState lane(String userId, int lane, int position) {
        return new LaneState(userId, lane, position);
    }

    @Test
    void lanesAdvanceInLaneOrder() {
        TickResult tick = simulator.tick(List.of(lane("b", 2, 0), lane("a", 1, 0)), new ScriptedRandom(3, 4));

        assertThat(tick.lanes()).containsExactly(lane("a", 1, 3), lane("b", 2, 4));
        assertThat(tick.advances()).containsEntry("a", 3).containsEntry("b", 4);
        assertThat(tick.leaderId()).isEqualTo("b");
        assertThat(tick.finished()).isFalse();
        assertThat(tick.winnerId()).isNull();
    }

    @Test
    void positionIsClampedAtFinishLine() {
        TickResult tick = simulator.tick(List.of(lane("a", 1, 8), lane("b", 2, 2)), new ScriptedRandom(5, 1));

        assertThat(tick.lanes()).containsExactly(lane("a", 1, 10), lane("b", 2, 3));
        assertThat(tick.advances()).containsEntry("a", 5);
        assertThat(tick.finishers()).containsExactly("a");
        assertThat(tick.winnerId()).isEqualTo("a");
    }

    @Test
    void simultaneousArrivalFavoursLargerAdvance() {
        TickResult tick = simulator.tick(
                List.of(lane("a", 1, 8), lane("b", 2, 7), lane("c", 3, 9)),
                new ScriptedRandom(2, 5, 1));

        assertThat(tick.finishers()).containsExactly("b", "a", "c");
        assertThat(tick.winnerId()).isEqualTo("b");
    }

    @Test
    void equalAdvanceArrivalFavoursLowerLane() {
        TickResult tick = simulator.tick(List.of(lane("b", 2, 6), lane("a", 1, 6)), new ScriptedRandom(4, 4));

        assertThat(tick.finishers()).containsExactly("a", "b");
    }

    @Test
    void leaderTieGoesToLowerLane() {
        TickResult tick = simulator.tick(List.of(lane("a", 1, 0), lane("b", 2, 0)), new ScriptedRandom(3, 3));

        assertThat(tick.leaderId()).isEqualTo("a");
    }

    @Test
    void rankingPlacesFinishersFirstThenByPosition() {
        List<RaceEntrant> entrants = new ArrayList<>();
        for (String id : List.of("a", "b", "c", "d")) {
            int laneNo = entrants.size() + 1;
            entrants.add(new RaceEntrant(id, id, laneNo, LaneColors.of(laneNo), 2000));
        }
        List<LaneState> finalLanes = List.of(lane("a", 1, 10), lane("b", 2, 7), lane("c", 3, 9), lane("d", 4, 7));

        List<RankedEntrant> ranking = simulator.rank(entrants, finalLanes, List.of("a"));

        assertThat(ranking).extracting(RankedEntrant::userId).containsExactly("a", "c", "b", "d");
        assertThat(ranking).extracting(RankedEntrant::rank).containsExactly(1, 2, 3, 4);
        assertThat(ranking.get(1).position()).isEqualTo(9);
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThatThrownBy(() -> new RaceSimulator(0, 1, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RaceSimulator(10, 0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RaceSimulator(10, 5, 3)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sameSeedReplaysSameRace() {
        assertThat(runToFinish(new SplittableRandom(99))).isEqualTo(runToFinish(new SplittableRandom(99)));
    }

    @Test
    void raceAlwaysTerminatesWithinTrackLength() {
        RaceSimulator full = new RaceSimulator(100, 1, 10);
        for (long seed = 0; seed < 200; seed++) {
            List<LaneState> lanes = List.of(lane("a", 1, 0), lane("b", 2, 0), lane("c", 3, 0));
            RandomGenerator random = new SplittableRandom(seed);
            int ticks = 0;
            TickResult tick;
            do {
                tick = full.tick(lanes, random);
                lanes = tick.lanes();
                ticks++;
            } while (!tick.finished());
            assertThat(ticks).isLessThanOrEqualTo(100);
            assertThat(lanes).allSatisfy(l -> assertThat(l.position()).isBetween(0, 100));
        }
    }

    private List<String> runToFinish(RandomGenerator random) {
        List<LaneState> lanes = List.of(lane("a", 1, 0), lane("b", 2, 0), lane("c", 3, 0));
        List<String> trace = new ArrayList<>();
        TickResult tick;
        do {
            tick = simulator.tick(lanes, random);
            lanes = tick.lanes();
            trace.add(tick.leaderId());
        } while (!tick.finished());
        trace.add("winner=" + tick.winnerId());
        return trace;
    }
}
