package com.racehub.raceservice.race.domain.error;

import com.racehub.raceservice.race.domain.constants.GameMessages;

/**
 * 对外错误码，ERROR 帧中的 code 字段即为枚举名。
 */
public enum ErrorCode {

    ROOM_NOT_FOUND(404, GameMessages.ROOM_NOT_FOUND),
    ROOM_FULL(409, GameMessages.ROOM_FULL),
    ALREADY_IN_ROOM(409, GameMessages.ALREADY_IN_ROOM),
    NOT_IN_ROOM(409, GameMessages.NOT_IN_ROOM),
    INVALID_WAGER(400, "下注金额不合法"),
    WAGER_MISMATCH(400, "下注金额与本轮不一致"),
    INSUFFICIENT_BALANCE(409, GameMessages.INSUFFICIENT_BALANCE),
    ALREADY_WAGERED(409, GameMessages.ALREADY_WAGERED),
    INVALID_PHASE_FOR_ACTION(409, "当前阶段不允许该操作"),
    WALLET_UNAVAILABLE(503, GameMessages.WALLET_UNAVAILABLE),
    INVALID_MESSAGE(400, GameMessages.INVALID_MESSAGE),
    UNKNOWN_MESSAGE(400, "未知消息类型"),
    AUTH_ERROR(401, GameMessages.AUTH_ERROR),
    INTERNAL_ERROR(500, GameMessages.INTERNAL_ERROR);

    private final int httpStatus;
    private final String defaultMessage;

    ErrorCode(int httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
