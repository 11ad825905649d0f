package com.racehub.raceservice.infrastructure.client.chat;

import com.racehub.raceservice.infrastructure.client.chat.dto.NotifyPushRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * chat-service 通知推送熔断兜底：大奖播报可丢，只记日志。
 */
@Component
@Slf4j
public class ChatNotifyClientFallback implements ChatNotifyClient {
    @Override
    public void push(NotifyPushRequest request) {
        log.warn("chat-service 大奖播报兜底，跳过推送: userId={}, title={}", request.getUserId(), request.getTitle());
    }
}
