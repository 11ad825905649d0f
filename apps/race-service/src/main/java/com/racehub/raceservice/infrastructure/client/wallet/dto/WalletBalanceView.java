package com.racehub.raceservice.infrastructure.client.wallet.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 钱包余额视图。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WalletBalanceView {
    private String userId;
    private long balance;
}
