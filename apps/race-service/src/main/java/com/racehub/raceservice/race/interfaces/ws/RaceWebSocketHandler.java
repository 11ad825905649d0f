package com.racehub.raceservice.race.interfaces.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.racehub.raceservice.platform.transport.Envelope;
import com.racehub.raceservice.platform.ws.ConnectionRegistry;
import com.racehub.raceservice.platform.ws.TokenHandshakeInterceptor;
import com.racehub.raceservice.platform.ws.WebSocketDisconnectHelper;
import com.racehub.raceservice.race.application.room.RoomRegistry;
import com.racehub.raceservice.race.domain.constants.GameMessages;
import com.racehub.raceservice.race.domain.error.ErrorCode;
import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.raceservice.race.domain.model.PlayerIdentity;
import com.racehub.raceservice.race.interfaces.ws.dto.MessageTypes;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.CreateRoomCmd;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.JoinRoomCmd;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.PlaceBetCmd;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.SetReadyCmd;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 鸭子赛跑 WebSocket 处理器
 * ----------------------------------------
 * 负责协议帧的收发与分派：
 *   1. 连接建立：校验握手结果，失败发 ERROR{AUTH_ERROR} 并以 1008 关闭；成功则登记连接并尝试恢复座位；
 *   2. 收到帧：按 type 分派到大厅，格式错误/未知类型只回 ERROR，连接保持；
 *   3. 连接关闭：当前连接关闭视为断线，被新登录顶替的旧连接不算。
 *
 * 房间内的拒绝（ROOM_FULL、WAGER_MISMATCH 等）由房间异步回给发起者，这里只处理大厅同步抛出的错误。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RaceWebSocketHandler extends TextWebSocketHandler {

    private final RoomRegistry roomRegistry;
    private final ConnectionRegistry connections;
    private final WebSocketDisconnectHelper disconnectHelper;
    private final ObjectMapper objectMapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        PlayerIdentity identity = identityOf(session);
        if (identity == null) {
            log.warn("WebSocket 鉴权失败，关闭连接: sessionId={}", session.getId());
            disconnectHelper.sendAndClose(session,
                    Envelope.error(ErrorCode.AUTH_ERROR.name(), GameMessages.AUTH_ERROR),
                    CloseStatus.POLICY_VIOLATION.withReason(ErrorCode.AUTH_ERROR.name()));
            return;
        }
        connections.register(identity.userId(), session);
        log.info("WebSocket 已连接: userId={}, sessionId={}", identity.userId(), session.getId());
        roomRegistry.onConnected(identity);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PlayerIdentity identity = identityOf(session);
        if (identity == null) {
            return;
        }
        connections.touch(session.getId());

        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            rejectFrame(session, identity, ErrorCode.INVALID_MESSAGE, GameMessages.INVALID_MESSAGE, e.getOriginalMessage());
            return;
        }
        if (frame == null || !frame.isObject() || !frame.path("type").isTextual()) {
            rejectFrame(session, identity, ErrorCode.INVALID_MESSAGE, GameMessages.INVALID_MESSAGE, "missing type");
            return;
        }
        String type = frame.get("type").asText();
        JsonNode payload = frame.path("payload");

        try {
            dispatch(session, identity, type, payload);
        } catch (RaceException e) {
            log.warn("命令被拒绝: userId={}, type={}, code={}, msg={}", identity.userId(), type, e.getCode(), e.getMessage());
            connections.sendToSession(session, Envelope.error(e.getCode().name(), e.getMessage()));
        } catch (IllegalArgumentException e) {
            // payload 绑定失败（字段类型不符等）
            rejectFrame(session, identity, ErrorCode.INVALID_MESSAGE, GameMessages.INVALID_MESSAGE, e.getMessage());
        }
    }

    private void dispatch(WebSocketSession session, PlayerIdentity identity, String type, JsonNode payload) {
        String userId = identity.userId();
        switch (type) {
            case MessageTypes.PING -> connections.sendToSession(session, Envelope.bare(MessageTypes.PONG));
            case MessageTypes.GET_ROOMS -> connections.sendToSession(session,
                    Envelope.of(MessageTypes.ROOM_LIST, roomRegistry.roomList(userId)));
            case MessageTypes.CREATE_ROOM -> {
                CreateRoomCmd cmd = bind(payload, CreateRoomCmd.class);
                roomRegistry.createRoom(identity, cmd.getBetAmount(), cmd.isPersistent(), cmd.getRoomName());
            }
            case MessageTypes.JOIN_ROOM -> roomRegistry.joinRoom(identity, bind(payload, JoinRoomCmd.class).getRoomId());
            case MessageTypes.LEAVE_ROOM -> roomRegistry.leaveRoom(userId);
            case MessageTypes.SET_READY -> roomRegistry.setReady(userId, bind(payload, SetReadyCmd.class).isReady());
            case MessageTypes.PLACE_BET -> roomRegistry.placeBet(userId, bind(payload, PlaceBetCmd.class).getAmount());
            default -> rejectFrame(session, identity, ErrorCode.UNKNOWN_MESSAGE,
                    GameMessages.formatUnknownMessage(type), type);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        PlayerIdentity identity = identityOf(session);
        if (identity == null) {
            return;
        }
        if (connections.unregister(identity.userId(), session.getId())) {
            log.info("WebSocket 断开: userId={}, sessionId={}, status={}", identity.userId(), session.getId(), status);
            roomRegistry.onDisconnected(identity.userId());
        } else {
            log.debug("旧连接关闭（已被顶替）: userId={}, sessionId={}", identity.userId(), session.getId());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket 传输异常: sessionId={}, ex={}", session.getId(), exception.toString());
    }

    private <T> T bind(JsonNode payload, Class<T> type) {
        JsonNode source = (payload == null || payload.isMissingNode() || payload.isNull())
                ? objectMapper.createObjectNode() : payload;
        return objectMapper.convertValue(source, type);
    }

    private void rejectFrame(WebSocketSession session, PlayerIdentity identity, ErrorCode code, String message, String detail) {
        log.warn("忽略非法帧: userId={}, code={}, detail={}", identity.userId(), code, detail);
        connections.sendToSession(session, Envelope.error(code.name(), message));
    }

    /**
     * @return 握手阶段写入的身份，鉴权失败时为 null
     */
    static PlayerIdentity identityOf(WebSocketSession session) {
        if (Boolean.TRUE.equals(session.getAttributes().get(TokenHandshakeInterceptor.ATTR_AUTH_ERROR))) {
            return null;
        }
        Object userId = session.getAttributes().get(TokenHandshakeInterceptor.ATTR_USER_ID);
        if (userId == null) {
            return null;
        }
        Object username = session.getAttributes().get(TokenHandshakeInterceptor.ATTR_USERNAME);
        return new PlayerIdentity(userId.toString(), username == null ? userId.toString() : username.toString());
    }
}
