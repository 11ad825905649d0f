package com.racehub.raceservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * RedisConfig
 * -------------------------------------------------------
 * Redis 连接配置（通用基础设施层）。
 * -------------------------------------------------------
 * 房间本身是进程内 actor，不落 Redis；这里只服务于结算台账，
 * 台账的值都是短字符串（状态名、金额），统一使用 StringRedisTemplate。
 */
@Configuration
public class RedisConfig {

    /**
     * 纯字符串操作模板，适合状态位、SETNX 幂等锁、计数等轻量操作。
     *
     * @param factory Redis 连接工厂（Lettuce）
     * @return StringRedisTemplate Bean
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }
}
