package com.racehub.raceservice.race.domain.enums;

/**
 * 下注金额的确定时机（按部署选择其一）。
 */
public enum WagerPolicy {

    /** 建房时确定，之后每一轮都沿用 */
    FIXED_AT_CREATION,

    /** 非常驻房间每轮回到 WAITING 时清零，由本轮第一位下注者确定；常驻房间仍固定 */
    FIRST_BET
}
