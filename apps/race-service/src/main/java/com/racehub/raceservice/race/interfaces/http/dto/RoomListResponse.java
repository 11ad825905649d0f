package com.racehub.raceservice.race.interfaces.http.dto;

import com.racehub.raceservice.race.domain.model.RoomSummary;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 房间列表接口的响应体（data 部分）。
 */
@Data
@AllArgsConstructor
public class RoomListResponse {
    private List<RoomSummary> rooms;
    /** 当前用户余额，钱包不可用时为 null */
    private Long yourBalance;
}
