package com.racehub.raceservice.race.domain.model;

/**
 * 单个参与者的结算结果：netResult = winnings - wager。
 * 退款结算中 winnings 等于 wager，netResult 为 0；rank 为 0 表示未排名。
 */
public record SettlementEntry(String userId, String username, int rank, long wager, long winnings, long netResult) {

    public static SettlementEntry of(String userId, String username, int rank, long wager, long winnings) {
        return new SettlementEntry(userId, username, rank, wager, winnings, winnings - wager);
    }
}
