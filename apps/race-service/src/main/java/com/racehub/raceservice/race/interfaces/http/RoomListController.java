package com.racehub.raceservice.race.interfaces.http;

import com.racehub.raceservice.race.application.room.RoomRegistry;
import com.racehub.raceservice.race.interfaces.http.dto.RoomListResponse;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RoomList;
import com.racehub.web.common.ApiResponse;
import com.racehub.web.common.CurrentUserHelper;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 鸭子赛跑大厅 - 在线房间列表查询（大厅页面首屏用，之后靠 WebSocket 推送增量）。
 */
@RestController
@RequestMapping("/api/race/rooms")
@RequiredArgsConstructor
public class RoomListController {

    private final RoomRegistry roomRegistry;

    /**
     * 房间列表（按创建顺序）与当前用户余额。
     */
    @GetMapping
    public ApiResponse<RoomListResponse> list(@AuthenticationPrincipal Jwt jwt) {
        RoomList list = roomRegistry.roomList(CurrentUserHelper.getUserId(jwt));
        return ApiResponse.success(new RoomListResponse(list.rooms(), list.yourBalance()));
    }
}
