package com.racehub.raceservice.infrastructure.client.wallet.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 钱包操作请求体。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WalletOperationRequest {
    private String userId;
    private long amount;
    private String reference;   // 业务幂等号：下注号 / settlementId
    private String reason;      // duck_race_bet / duck_race_win / duck_race_refund
}
