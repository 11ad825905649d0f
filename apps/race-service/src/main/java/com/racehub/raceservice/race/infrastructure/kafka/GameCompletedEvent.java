package com.racehub.raceservice.race.infrastructure.kafka;

import com.racehub.raceservice.race.domain.model.Settlement;
import com.racehub.raceservice.race.domain.model.SettlementEntry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一名参与者的一场比赛结果，每场比赛按参与者各发一条。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameCompletedEvent {

    public static final String GAME_TYPE = "duck_race";

    private String userId;
    private String gameId;      // roundId
    private String gameType;
    private String roomId;
    private long totalBet;
    private long totalWin;
    private long netResult;
    private int rank;
    private long occurredAt;

    public static GameCompletedEvent of(Settlement settlement, SettlementEntry entry, long occurredAt) {
        return new GameCompletedEvent(entry.userId(), settlement.roundId(), GAME_TYPE, settlement.roomId(),
                entry.wager(), entry.winnings(), entry.netResult(), entry.rank(), occurredAt);
    }
}
