package com.racehub.raceservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * race-service 启动入口。
 * 通过 @EnableFeignClients 启用钱包、聊天等协作服务的 Feign Client。
 */
@SpringBootApplication
@EnableFeignClients
@ConfigurationPropertiesScan
public class RaceServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaceServiceApplication.class, args);
    }
}
