package com.racehub.raceservice.race.domain.error;

import lombok.Getter;

/**
 * 领域拒绝：在修改房间状态之前抛出，只回给发起命令的会话。
 */
@Getter
public class RaceException extends RuntimeException {

    private final ErrorCode code;

    public RaceException(ErrorCode code) {
        this(code, code.defaultMessage());
    }

    public RaceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RaceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
