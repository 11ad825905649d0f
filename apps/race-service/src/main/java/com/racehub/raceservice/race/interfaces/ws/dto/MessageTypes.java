package com.racehub.raceservice.race.interfaces.ws.dto;

/**
 * WebSocket 帧的 type 取值。
 */
public final class MessageTypes {

    private MessageTypes() {}

    // ========== 客户端 → 服务端 ==========
    public static final String GET_ROOMS = "GET_ROOMS";
    public static final String CREATE_ROOM = "CREATE_ROOM";
    public static final String JOIN_ROOM = "JOIN_ROOM";
    public static final String LEAVE_ROOM = "LEAVE_ROOM";
    public static final String SET_READY = "SET_READY";
    public static final String PLACE_BET = "PLACE_BET";
    public static final String PING = "PING";

    // ========== 服务端 → 客户端：大厅 ==========
    public static final String ROOM_LIST = "ROOM_LIST";
    public static final String ROOM_CREATED = "ROOM_CREATED";
    public static final String ROOM_UPDATED = "ROOM_UPDATED";
    public static final String ROOM_DELETED = "ROOM_DELETED";

    // ========== 服务端 → 客户端：房间 ==========
    public static final String RACE_STATE = "RACE_STATE";
    public static final String PLAYER_JOINED = "PLAYER_JOINED";
    public static final String PLAYER_LEFT = "PLAYER_LEFT";
    public static final String BET_PLACED = "BET_PLACED";
    public static final String PLAYER_READY = "PLAYER_READY";
    public static final String BETTING_STARTED = "BETTING_STARTED";
    public static final String COUNTDOWN_TICK = "COUNTDOWN_TICK";
    public static final String RACE_STARTED = "RACE_STARTED";
    public static final String RACE_UPDATE = "RACE_UPDATE";
    public static final String RACE_FINISHED = "RACE_FINISHED";
    public static final String WAITING_FOR_PLAYERS = "WAITING_FOR_PLAYERS";

    // ========== 服务端 → 客户端：个人 ==========
    public static final String BALANCE_UPDATE = "BALANCE_UPDATE";
    public static final String KICKED = "KICKED";
    public static final String ERROR = "ERROR";
    public static final String PONG = "PONG";
}
