package com.racehub.raceservice.infrastructure.client.chat.dto;

import lombok.Builder;
import lombok.Data;

/**
 * chat-service 通知推送请求体。
 */
@Data
@Builder
public class NotifyPushRequest {
    private String userId;          // 目标用户（为空表示全服播报）
    private String type;            // 通知类型：BIG_WIN
    private String title;
    private String content;
    private Object payload;         // 透传数据
}
