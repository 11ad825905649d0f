package com.racehub.raceservice.infrastructure.kafka;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 比赛事件 Kafka 生产者配置。
 *
 * 配置要求（application.yml）：
 * <pre>
 * race:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: race.game-completed
 * </pre>
 *
 * 只做生产者：统计、排行榜等下游自行订阅。
 */
@Configuration
public class RaceKafkaConfig {

    @Value("${race.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /**
     * 创建 Kafka 生产者工厂，Key/Value 均为 String（Value 为 JSON 字符串）。
     */
    @Bean
    public ProducerFactory<String, String> raceKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 等待所有副本确认
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        // 幂等生产：重试不会产生重复消息（要求 acks=all）
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> raceKafkaTemplate() {
        return new KafkaTemplate<>(raceKafkaProducerFactory());
    }
}
