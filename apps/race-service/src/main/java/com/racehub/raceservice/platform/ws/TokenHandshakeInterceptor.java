package com.racehub.raceservice.platform.ws;

import com.racehub.web.common.CurrentUserHelper;
import com.racehub.web.common.CurrentUserInfo;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * WebSocket 握手认证拦截器
 *
 * 在握手阶段验证 JWT 并把用户身份写入会话属性，供后续消息处理使用。
 * token 来源：URL 查询参数 token，或 Authorization: Bearer 请求头。
 * 验证失败时不拒绝握手，只标记 authError，由处理器发出 ERROR{AUTH_ERROR} 后关闭连接。
 */
@Slf4j
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_USER_ID = "userId";
    public static final String ATTR_USERNAME = "username";
    public static final String ATTR_AUTH_ERROR = "authError";

    private final JwtDecoder jwtDecoder;

    public TokenHandshakeInterceptor(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = extractToken(request);
        if (StringUtils.isBlank(token)) {
            attributes.put(ATTR_AUTH_ERROR, Boolean.TRUE);
            return true;
        }
        try {
            Jwt jwt = jwtDecoder.decode(token);
            CurrentUserInfo user = CurrentUserHelper.from(jwt);
            if (user == null) {
                attributes.put(ATTR_AUTH_ERROR, Boolean.TRUE);
                return true;
            }
            attributes.put(ATTR_USER_ID, user.userId());
            attributes.put(ATTR_USERNAME, user.getDisplayName());
        } catch (JwtException e) {
            log.warn("WebSocket 握手 token 校验失败: uri={}, ex={}", request.getURI().getPath(), e.getMessage());
            attributes.put(ATTR_AUTH_ERROR, Boolean.TRUE);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // 无需处理
    }

    /**
     * 先取查询参数 token，再取 Authorization 头。
     */
    static String extractToken(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI()).build()
                .getQueryParams().getFirst("token");
        if (StringUtils.isNotBlank(fromQuery)) {
            return fromQuery.trim();
        }
        String auth = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.toLowerCase().startsWith("bearer ")) {
            return auth.substring(7).trim();
        }
        return null;
    }
}
