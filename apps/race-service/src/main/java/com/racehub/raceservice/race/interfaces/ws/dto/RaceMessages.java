package com.racehub.raceservice.race.interfaces.ws.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.racehub.raceservice.race.domain.enums.BalanceReason;
import com.racehub.raceservice.race.domain.enums.RacePhase;
import com.racehub.raceservice.race.domain.model.PlayerIdentity;
import com.racehub.raceservice.race.domain.model.RaceEntrant;
import com.racehub.raceservice.race.domain.model.RoomSummary;
import lombok.Data;

import java.util.List;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 本类定义了前端与后端通过 WebSocket 交互时使用的消息格式。
 * 包含两种方向：
 *   1. 前端 -> 后端：客户端发起的指令（xxxCmd），由 Jackson 从帧的 payload 绑定；
 *   2. 后端 -> 前端：服务端推送的载荷，作为 Envelope.payload 序列化。
 *
 * 布尔字段在线上统一使用 isXxx 命名，这里用 @JsonProperty 固定。
 */
public class RaceMessages {

    // ================= 客户端 → 服务端 =================

    /**
     * 建房命令
     *   - betAmount   ：本房间下注额，不低于最小下注额；
     *   - isPersistent：常驻房间清空后不销毁；
     *   - roomName    ：可空，为空时用建房人名字生成。
     */
    @Data
    public static class CreateRoomCmd {
        private long betAmount;
        @JsonProperty("isPersistent")
        private boolean persistent;
        private String roomName;
    }

    @Data
    public static class JoinRoomCmd {
        private String roomId;
    }

    @Data
    public static class SetReadyCmd {
        @JsonProperty("isReady")
        private boolean ready;
    }

    @Data
    public static class PlaceBetCmd {
        private long amount;
    }

    // ================= 服务端 → 客户端 =================

    public record PlayerView(String userId,
                             String username,
                             boolean hasBet,
                             @JsonProperty("isReady") boolean ready,
                             int position,
                             int lane,
                             String color,
                             @JsonProperty("isConnected") boolean connected) {
    }

    /**
     * 完整房间快照：加入、重连、排队旁观时下发给本人。
     * yourBalance 在钱包不可用时为 null；spectating 表示本轮排队、下一轮入座。
     */
    public record RaceState(String roomId,
                            String roomName,
                            String roundId,
                            RacePhase phase,
                            long timeRemaining,
                            long betAmount,
                            long totalPot,
                            String creatorId,
                            String creatorUsername,
                            @JsonProperty("isPersistent") boolean persistent,
                            int capacity,
                            List<PlayerView> players,
                            Long yourBalance,
                            boolean yourHasBet,
                            Integer yourLane,
                            boolean spectating) {
    }

    public record PlayerJoined(String userId, String username, int lane, String color, int playerCount) {
    }

    public record PlayerLeft(String userId, String username, int playerCount, boolean refunded) {
    }

    public record BetPlaced(String userId, String username, long betAmount, long totalPot, int playersWithBets) {
    }

    public record PlayerReady(String userId,
                              String username,
                              @JsonProperty("isReady") boolean ready,
                              int readyCount,
                              int totalPlayers,
                              long totalPot) {
    }

    public record BettingStarted(String roundId, long betAmount, long timeRemaining, PlayerIdentity triggeredBy) {
    }

    /** 下注窗口与开跑倒计时共用，phase 区分 */
    public record CountdownTick(RacePhase phase, long timeRemaining) {
    }

    public record RaceStarted(String roundId, RacePhase phase, long totalPot, List<RaceEntrant> players) {
    }

    public record LanePosition(String userId, int lane, int position, int advance) {
    }

    public record RaceUpdate(List<LanePosition> positions, String leaderId) {
    }

    public record Winner(String userId, String username, int lane, String color, long winnings) {
    }

    public record FinalPosition(String userId, String username, int position, int lane, int rank) {
    }

    public record YourResult(int rank, long betAmount, long winnings, long netResult) {
    }

    /** yourResult 只发给本轮参赛者，旁观者为 null */
    public record RaceFinished(String roundId,
                               RacePhase phase,
                               Winner winner,
                               List<FinalPosition> finalPositions,
                               long totalPot,
                               YourResult yourResult,
                               long timeUntilNextRace) {
    }

    public record WaitingForPlayers(String roundId, RacePhase phase, int playerCount, int minPlayers, String message) {
    }

    public record BalanceUpdate(long balance, BalanceReason reason) {
    }

    public record RoomList(List<RoomSummary> rooms, Long yourBalance) {
    }

    /** ROOM_CREATED / ROOM_UPDATED */
    public record RoomEvent(RoomSummary room) {
    }

    public record RoomDeleted(String roomId) {
    }

    public record Kicked(String reason) {
    }
}
