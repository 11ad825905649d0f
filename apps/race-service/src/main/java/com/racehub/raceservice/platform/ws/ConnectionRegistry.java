package com.racehub.raceservice.platform.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.racehub.raceservice.platform.transport.Envelope;
import com.racehub.raceservice.race.application.room.PlayerNotifier;
import com.racehub.raceservice.race.domain.constants.GameMessages;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在线连接表（单节点内存）
 * ----------------------------------------
 * 1. userId → 当前连接，同一用户只保留最新连接，旧连接收到 KICKED 后被关闭；
 * 2. 记录每个连接最后一次收到帧的时间，供心跳巡检；
 * 3. 实现 {@link PlayerNotifier}：房间与大厅经由这里推送，发送失败只记日志。
 *
 * 连接统一包装为 ConcurrentWebSocketSessionDecorator，多个房间线程可并发推送同一连接。
 */
@Slf4j
@Component
public class ConnectionRegistry implements PlayerNotifier {

    /** 单条推送的发送超时（毫秒） */
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    /** 单连接待发送缓冲上限（字节） */
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final WebSocketDisconnectHelper disconnectHelper;
    private final Clock clock;

    /** sessionId → 包装后的连接 */
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    /** userId → 当前 sessionId */
    private final Map<String, String> userSessions = new ConcurrentHashMap<>();
    /** sessionId → 最后活跃时间 */
    private final Map<String, Long> lastSeen = new ConcurrentHashMap<>();

    public ConnectionRegistry(ObjectMapper objectMapper, WebSocketDisconnectHelper disconnectHelper, Clock raceClock) {
        this.objectMapper = objectMapper;
        this.disconnectHelper = disconnectHelper;
        this.clock = raceClock;
    }

    /**
     * 登记已通过鉴权的连接；同一用户已有连接时踢掉旧连接。
     * @return 被顶替的旧 sessionId，没有则为 null
     */
    public String register(String userId, WebSocketSession raw) {
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        sessions.put(raw.getId(), session);
        lastSeen.put(raw.getId(), clock.millis());
        String previous = userSessions.put(userId, raw.getId());
        if (previous != null && !previous.equals(raw.getId())) {
            WebSocketSession old = sessions.remove(previous);
            lastSeen.remove(previous);
            if (old != null) {
                log.info("单点登录，踢掉旧连接: userId={}, oldSessionId={}, newSessionId={}", userId, previous, raw.getId());
                disconnectHelper.sendKickMessage(old, GameMessages.SESSION_REPLACED);
                disconnectHelper.forceDisconnect(old, WebSocketDisconnectHelper.KICKED);
            }
            return previous;
        }
        return null;
    }

    /**
     * 连接关闭时注销。
     * @return true 表示这是该用户的当前连接（真正断线）；被顶替的旧连接返回 false
     */
    public boolean unregister(String userId, String sessionId) {
        sessions.remove(sessionId);
        lastSeen.remove(sessionId);
        return userId != null && userSessions.remove(userId, sessionId);
    }

    /** 收到任意帧即视为活跃 */
    public void touch(String sessionId) {
        lastSeen.computeIfPresent(sessionId, (id, ts) -> clock.millis());
    }

    /**
     * @param cutoffEpochMs 早于该时间未活跃的连接视为超时
     */
    public List<WebSocketSession> staleSessions(long cutoffEpochMs) {
        List<WebSocketSession> stale = new ArrayList<>();
        lastSeen.forEach((sessionId, ts) -> {
            if (ts < cutoffEpochMs) {
                WebSocketSession s = sessions.get(sessionId);
                if (s != null) {
                    stale.add(s);
                }
            }
        });
        return stale;
    }

    public boolean isOnline(String userId) {
        return userSessions.containsKey(userId);
    }

    public int onlineCount() {
        return userSessions.size();
    }

    /**
     * 直接回复某个连接（握手后、登记前也可用）。
     */
    public void sendToSession(WebSocketSession raw, Envelope<?> message) {
        WebSocketSession session = sessions.getOrDefault(raw.getId(), raw);
        send(session, message);
    }

    @Override
    public void sendTo(String userId, Envelope<?> message) {
        String sessionId = userSessions.get(userId);
        WebSocketSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            log.debug("用户不在线，丢弃推送: userId={}, type={}", userId, message.type());
            return;
        }
        send(session, message);
    }

    @Override
    public void broadcastAll(Envelope<?> message) {
        String text = serialize(message);
        if (text == null) {
            return;
        }
        for (WebSocketSession session : sessions.values()) {
            sendText(session, text, message.type());
        }
    }

    private void send(WebSocketSession session, Envelope<?> message) {
        String text = serialize(message);
        if (text != null) {
            sendText(session, text, message.type());
        }
    }

    private void sendText(WebSocketSession session, String text, String type) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (IOException | IllegalStateException e) {
            log.warn("推送失败: sessionId={}, type={}, ex={}", session.getId(), type, e.toString());
        }
    }

    private String serialize(Envelope<?> message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("消息序列化失败: type={}", message.type(), e);
            return null;
        }
    }
}
