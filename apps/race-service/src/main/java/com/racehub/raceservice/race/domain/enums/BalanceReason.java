package com.racehub.raceservice.race.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * BALANCE_UPDATE 的余额变动原因。
 */
public enum BalanceReason {

    BET_PLACED("bet_placed"),
    WIN_CREDITED("win_credited"),
    REFUND("refund");

    private final String wire;

    BalanceReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
