package com.questhub.combatservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * combat-service 启动入口。
 * 通过 @ConfigurationPropertiesScan 统一启用 combat.* 配置绑定。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CombatServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CombatServiceApplication.class, args);
    }
}
