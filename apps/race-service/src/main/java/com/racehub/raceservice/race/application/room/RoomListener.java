package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.race.domain.model.RoomSummary;

/**
 * 房间向大厅回报的事件，回调运行在房间线程上，实现不得反向等待房间。
 */
public interface RoomListener {

    /** 房间摘要发生变化（人数、阶段、下注数等） */
    void onSummaryChanged(RaceRoom room, RoomSummary summary);

    /** 玩家被房间移除（离开生效、宽限期到期、排队者掉线） */
    void onPlayerRemoved(String roomId, String userId);

    /** 房间已关闭（清空销毁或致命错误），计时器已取消 */
    void onRoomClosed(RaceRoom room);
}
