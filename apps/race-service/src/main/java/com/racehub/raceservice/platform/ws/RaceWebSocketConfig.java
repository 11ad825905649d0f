package com.racehub.raceservice.platform.ws;

import com.racehub.raceservice.race.interfaces.ws.RaceWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 配置类
 *
 * 比赛协议是裸 JSON 帧（type + payload + timestamp），不走 STOMP：
 * - 端点：/ws/race（握手时带 token）
 * - 鉴权：{@link TokenHandshakeInterceptor} 在握手阶段解析 JWT
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class RaceWebSocketConfig implements WebSocketConfigurer {

    private final RaceWebSocketHandler raceWebSocketHandler;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;

    @Value("${race.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(raceWebSocketHandler, "/ws/race")
                .addInterceptors(tokenHandshakeInterceptor)
                // 开发环境允许所有来源，生产环境通过配置收紧
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
