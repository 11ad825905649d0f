package com.racehub.raceservice.race.domain.model;

import com.racehub.raceservice.race.domain.constants.LaneColors;
import lombok.Getter;

/**
 * 房间内占据一条赛道的玩家。
 * 只在所属房间的串行上下文中读写，不做并发保护。
 */
@Getter
public class Player {

    private final String userId;
    private final String username;
    /** 赛道号，加入时分配，在座期间不变 */
    private final int lane;
    private final String color;

    private boolean wagered;
    private long wager;
    private int position;
    /** false 表示断线但仍在宽限期内，区别于离开 */
    private boolean connected = true;
    /** 比赛中申请离开，等到 FINISHED 再移除 */
    private boolean leaving;

    public Player(String userId, String username, int lane) {
        this.userId = userId;
        this.username = username;
        this.lane = lane;
        this.color = LaneColors.of(lane);
    }

    public void placeWager(long amount) {
        this.wagered = true;
        this.wager = amount;
    }

    /** @return 清除前的下注额 */
    public long clearWager() {
        long amount = wager;
        this.wagered = false;
        this.wager = 0;
        return amount;
    }

    public void moveTo(int position) {
        this.position = position;
    }

    public void markDisconnected() {
        this.connected = false;
    }

    public void markConnected() {
        this.connected = true;
    }

    public void markLeaving() {
        this.leaving = true;
    }

    public void cancelLeaving() {
        this.leaving = false;
    }
}
