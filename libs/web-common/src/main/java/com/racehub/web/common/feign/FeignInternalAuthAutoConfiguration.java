package com.racehub.web.common.feign;

import feign.RequestInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;

/**
 * Feign 服务间鉴权自动配置。
 *
 * 比赛结算、下注扣款都发生在房间线程或结算线程里，手上没有玩家的 JWT，
 * 因此统一携带服务间凭证（X-Internal-Token）访问钱包、聊天等内部接口。
 *
 * 使用条件：当项目中存在 OpenFeign 依赖时自动启用。
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(name = "org.springframework.cloud.openfeign.FeignClient")
public class FeignInternalAuthAutoConfiguration {

    public static final String INTERNAL_TOKEN_HEADER = "X-Internal-Token";

    @Bean
    public RequestInterceptor internalTokenRequestInterceptor(@Value("${internal.api-key:}") String apiKey) {
        return template -> {
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("未配置 internal.api-key，Feign 调用将不携带服务间凭证, url={}", template.url());
                return;
            }
            template.header(INTERNAL_TOKEN_HEADER, apiKey);
        };
    }
}
