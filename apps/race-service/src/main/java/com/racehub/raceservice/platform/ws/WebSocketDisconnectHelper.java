package com.racehub.raceservice.platform.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.racehub.raceservice.platform.transport.Envelope;
import com.racehub.raceservice.race.interfaces.ws.dto.MessageTypes;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.Kicked;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * WebSocket 断连工具类。
 *
 * 提供统一的断连方法，供多个组件复用：
 * - {@link ConnectionRegistry}：单点登录时踢掉旧连接
 * - {@link HeartbeatMonitor}：心跳超时断开连接
 * - 握手鉴权失败时拒绝连接
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketDisconnectHelper {

    /** 旧连接被新登录顶替 */
    public static final CloseStatus KICKED = new CloseStatus(4001, "KICKED");

    private final ObjectMapper objectMapper;

    /**
     * 向客户端发送踢人通知。
     *
     * @param session 被踢的连接
     * @param reason  踢人原因
     */
    public void sendKickMessage(WebSocketSession session, String reason) {
        send(session, Envelope.of(MessageTypes.KICKED, new Kicked(reason)));
    }

    /**
     * 先发一帧再关闭连接（AUTH_ERROR / KICKED 等）。
     */
    public void sendAndClose(WebSocketSession session, Envelope<?> message, CloseStatus status) {
        send(session, message);
        forceDisconnect(session, status);
    }

    /**
     * 强制断开 WebSocket 连接。
     *
     * @param session 连接
     * @param status  关闭码
     */
    public void forceDisconnect(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.warn("强制断开连接失败: sessionId={}, status={}", session.getId(), status, e);
        }
    }

    private void send(WebSocketSession session, Envelope<?> message) {
        try {
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
            }
        } catch (JsonProcessingException e) {
            log.error("消息序列化失败: type={}", message.type(), e);
        } catch (IOException | IllegalStateException e) {
            log.warn("发送消息失败: sessionId={}, type={}", session.getId(), message.type(), e);
        }
    }
}
