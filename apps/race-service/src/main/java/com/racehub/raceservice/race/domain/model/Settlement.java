package com.racehub.raceservice.race.domain.model;

import java.util.List;

/**
 * 一次结算（比赛派奖或退款），settlementId 即幂等键。
 */
public record Settlement(String settlementId,
                         Type type,
                         String roomId,
                         String roundId,
                         long pot,
                         String winnerId,
                         List<SettlementEntry> entries) {

    public enum Type { RACE, REFUND }

    public Settlement {
        entries = List.copyOf(entries);
    }

    /** 需要入账的条目（winnings > 0） */
    public List<SettlementEntry> payouts() {
        return entries.stream().filter(e -> e.winnings() > 0).toList();
    }

    public long totalNetResult() {
        return entries.stream().mapToLong(SettlementEntry::netResult).sum();
    }

    public SettlementEntry entryOf(String userId) {
        return entries.stream().filter(e -> e.userId().equals(userId)).findFirst().orElse(null);
    }
}
