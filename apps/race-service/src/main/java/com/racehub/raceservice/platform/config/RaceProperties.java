package com.racehub.raceservice.platform.config;

import com.racehub.raceservice.race.domain.enums.WagerPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 鸭子赛跑规则与节奏配置。
 *
 * 支持通过 application.yml 或环境变量覆盖（前缀 race）。
 */
@Data
@ConfigurationProperties(prefix = "race")
public class RaceProperties {

    /** 开赛最少下注人数 */
    private int minPlayers = 2;

    /** 房间容量（赛道数），取值 2..5 */
    private int maxCapacity = 5;

    /** 最小下注额 */
    private long minBet = 2000;

    /** 赛道长度 */
    private int trackLength = 100;

    /** 每帧随机前进步长下限（含） */
    private int advanceMin = 1;

    /** 每帧随机前进步长上限（含） */
    private int advanceMax = 10;

    /** 比赛帧间隔（毫秒） */
    private long tickIntervalMs = 500;

    /** 下注窗口（秒） */
    private int bettingSeconds = 15;

    /** 开跑倒计时（秒） */
    private int countdownSeconds = 3;

    /** 结算展示冷却（秒） */
    private int cooldownSeconds = 8;

    /** 断线重连宽限期（秒） */
    private int graceSeconds = 30;

    /** 心跳超时（秒），超过未收到任何帧视为断线 */
    private int heartbeatTimeoutSeconds = 60;

    /** 心跳巡检间隔（秒） */
    private int heartbeatSweepSeconds = 10;

    /** 下注额确定时机，按部署二选一 */
    private WagerPolicy wagerPolicy = WagerPolicy.FIXED_AT_CREATION;

    /** 大奖通知阈值（派奖金额达到即通知） */
    private long bigWinThreshold = 10000;

    private DefaultRoom defaultRoom = new DefaultRoom();

    /**
     * 启动时创建的常驻大厅房间。
     */
    @Data
    public static class DefaultRoom {
        private boolean enabled = true;
        private String roomId = "duck-race-main";
        private String name = "Duck Race";
        private long betAmount = 2000;
    }
}
