package com.racehub.raceservice.race.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "race:";

    private RedisKeys() {}

    // ---- 结算幂等锁 / 状态 ----
    public static String settlementStatus(String settlementId) {
        return PFX + "settlement:" + settlementId + ":status";
    }

    // ---- 结算结果（Hash：userId -> netResult） ----
    public static String settlementResults(String settlementId) {
        return PFX + "settlement:" + settlementId + ":results";
    }

    // ---- 待补发派奖（Hash：userId -> amount） ----
    public static String pendingPayouts(String settlementId) {
        return PFX + "settlement:" + settlementId + ":pending";
    }

    /** 所有待补发的结算ID（SET），供补偿任务扫描 */
    public static String pendingPayoutIndex() {
        return PFX + "settlement:pending:index";
    }

    // ---- 未确认扣款（Hash：userId / amount / reason） ----
    public static String unconfirmedDebit(String reference) {
        return PFX + "debit:" + reference + ":unconfirmed";
    }

    /** 所有未确认扣款的下注幂等号（SET） */
    public static String unconfirmedDebitIndex() {
        return PFX + "debit:unconfirmed:index";
    }
}
