package com.racehub.raceservice.race.application.settlement;

import java.util.List;
import java.util.Map;

/**
 * 一次结算的执行结果。
 *
 * @param settlementId   结算ID
 * @param applied        false 表示台账中已存在，本次为重复提交，未动钱包
 * @param balances       已入账玩家的最新余额
 * @param pendingUserIds 重试耗尽、等待补发的玩家
 */
public record SettlementOutcome(String settlementId,
                                boolean applied,
                                Map<String, Long> balances,
                                List<String> pendingUserIds) {

    public SettlementOutcome {
        balances = Map.copyOf(balances);
        pendingUserIds = List.copyOf(pendingUserIds);
    }

    public static SettlementOutcome duplicate(String settlementId) {
        return new SettlementOutcome(settlementId, false, Map.of(), List.of());
    }

    public boolean fullyPaid() {
        return applied && pendingUserIds.isEmpty();
    }
}
