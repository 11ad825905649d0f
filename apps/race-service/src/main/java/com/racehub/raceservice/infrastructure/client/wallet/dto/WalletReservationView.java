package com.racehub.raceservice.infrastructure.client.wallet.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 余额预留结果。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WalletReservationView {
    private boolean ok;
    private long balance;
}
