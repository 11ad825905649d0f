package com.racehub.raceservice.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 最小化的安全配置（Resource Server）
 * -------------------------------------------------------
 * 目标：作为下游资源服务器验证从网关透传的 JWT。
 *
 * 关键点：
 *  - 只开启 JWT 资源服务器能力（oauth2ResourceServer().jwt()）。
 *  - 放行 /actuator/** 与 /ws/**；WebSocket 在握手拦截器中自行校验 token。
 *  - 其余路径（大厅 REST）要求已认证。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**").permitAll()
                        // 浏览器 WebSocket 无法带 Authorization 头，token 走查询参数，由握手拦截器校验
                        .requestMatchers("/ws/**").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(jwt -> {}));
        return http.build();
    }
}
