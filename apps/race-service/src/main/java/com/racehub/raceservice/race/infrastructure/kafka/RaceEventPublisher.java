package com.racehub.raceservice.race.infrastructure.kafka;

import com.alibaba.fastjson2.JSON;
import com.racehub.raceservice.race.domain.model.Settlement;
import com.racehub.raceservice.race.domain.model.SettlementEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 比赛结果事件发布器（fire-and-forget）。
 *
 * 发送失败只记日志：比赛结果以结算台账为准，事件只服务于统计类下游。
 */
@Slf4j
@Component
public class RaceEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${race.kafka.topic:race.game-completed}")
    private String topic;

    public RaceEventPublisher(@Qualifier("raceKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * 为每个参与者发布一条比赛完成事件。
     */
    public void publishGameCompleted(Settlement settlement, long occurredAt) {
        for (SettlementEntry entry : settlement.entries()) {
            publish(GameCompletedEvent.of(settlement, entry, occurredAt));
        }
    }

    public void publish(GameCompletedEvent event) {
        try {
            String message = JSON.toJSONString(event);
            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, event.getUserId(), message);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("比赛完成事件发布成功: userId={}, gameId={}, offset={}",
                            event.getUserId(), event.getGameId(), result.getRecordMetadata().offset());
                } else {
                    log.error("比赛完成事件发布失败: userId={}, gameId={}", event.getUserId(), event.getGameId(), ex);
                }
            });
        } catch (Exception e) {
            log.error("发布比赛完成事件异常: userId={}, gameId={}", event.getUserId(), event.getGameId(), e);
        }
    }
}
