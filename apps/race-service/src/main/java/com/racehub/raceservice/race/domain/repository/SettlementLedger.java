package com.racehub.raceservice.race.domain.repository;

import com.racehub.raceservice.race.domain.model.Settlement;

import java.util.Optional;

/**
 * SettlementLedger
 * ----------------------------------------
 * 结算台账：以 settlementId 为幂等键，保证同一轮结算只被执行一次。
 * 当前实现为 Redis。
 */
public interface SettlementLedger {

    /** 结算状态 */
    enum Status { SETTLING, SETTLED, PENDING_PAYOUT }

    /**
     * 抢占结算权（SETNX）。
     * @param settlement 待执行的结算
     * @return true 表示首次抢占成功；false 表示该结算已被执行过或正在执行
     */
    boolean claim(Settlement settlement);

    /**
     * 记录所有参与者的净输赢。
     * @param settlement 结算
     */
    void recordResults(Settlement settlement);

    /**
     * 全部派奖完成。
     * @param settlementId 结算ID
     */
    void markSettled(String settlementId);

    /**
     * 派奖重试耗尽：结果保留，等待人工或补偿任务补发。
     * @param settlementId 结算ID
     * @param userId       未入账的玩家
     * @param amount       未入账金额
     * @param reason       失败原因
     */
    void markPendingPayout(String settlementId, String userId, long amount, String reason);

    /**
     * 预留成功但扣款未确认（失败或超时，钱包侧可能已扣）：登记下注幂等号，供对账补偿。
     * @param reference 下注幂等号
     * @param userId    玩家
     * @param amount    下注额
     * @param reason    失败原因
     */
    void markUnconfirmedDebit(String reference, String userId, long amount, String reason);

    /**
     * 查询结算状态。
     * @param settlementId 结算ID
     * @return 状态，未结算时为 empty
     */
    Optional<Status> status(String settlementId);
}
