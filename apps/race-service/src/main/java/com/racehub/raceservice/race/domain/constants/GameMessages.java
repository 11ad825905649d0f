package com.racehub.raceservice.race.domain.constants;

/**
 * 鸭子赛跑相关的用户可见提示。
 * 统一管理所有 ERROR / 系统消息文案，避免硬编码。
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 房间 ==========

    public static final String ROOM_NOT_FOUND = "房间不存在";

    public static final String ROOM_FULL = "房间已满";

    public static final String ALREADY_IN_ROOM = "你已在其他房间中，请先离开";

    public static final String NOT_IN_ROOM = "你不在该房间中";

    // ========== 下注 ==========

    /** 低于最小下注额（需要格式化，传入最小下注额） */
    public static final String INVALID_WAGER = "最小下注额为 %d";

    /** 金额与本轮下注额不一致（需要格式化，传入本轮下注额） */
    public static final String WAGER_MISMATCH = "本轮需下注 %d";

    public static final String WAGER_NOT_SET = "本轮下注额尚未确定，请使用 PLACE_BET 指定金额";

    public static final String INSUFFICIENT_BALANCE = "余额不足";

    public static final String ALREADY_WAGERED = "本轮已下注";

    public static final String WALLET_UNAVAILABLE = "钱包服务暂不可用，请稍后再试";

    /** 当前阶段不允许的操作（需要格式化，传入阶段名） */
    public static final String INVALID_PHASE = "当前阶段（%s）不允许该操作";

    public static String formatMinBet(long minBet) {
        return String.format(INVALID_WAGER, minBet);
    }

    public static String formatWagerMismatch(long wagerAmount) {
        return String.format(WAGER_MISMATCH, wagerAmount);
    }

    public static String formatInvalidPhase(String phase) {
        return String.format(INVALID_PHASE, phase);
    }

    // ========== 协议 ==========

    public static final String INVALID_MESSAGE = "消息格式错误";

    /** 未知消息类型（需要格式化，传入类型） */
    public static final String UNKNOWN_MESSAGE = "未知消息类型: %s";

    public static final String AUTH_ERROR = "身份验证失败";

    public static final String INTERNAL_ERROR = "服务器内部错误";

    public static String formatUnknownMessage(String type) {
        return String.format(UNKNOWN_MESSAGE, type);
    }

    // ========== 系统消息 ==========

    /** 等待玩家下注（需要格式化，传入最少人数） */
    public static final String WAITING_FOR_PLAYERS = "等待玩家下注，至少需要 %d 名玩家";

    public static final String NOT_ENOUGH_PLAYERS = "下注人数不足，已退还下注，等待下一轮";

    public static final String SESSION_REPLACED = "账号已在其他终端登录";

    public static final String HEARTBEAT_TIMEOUT = "心跳超时";

    public static String formatWaitingForPlayers(int minPlayers) {
        return String.format(WAITING_FOR_PLAYERS, minPlayers);
    }
}
