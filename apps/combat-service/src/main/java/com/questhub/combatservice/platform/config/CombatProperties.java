package com.questhub.combatservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 战斗服务配置（combat.*）
 */
@Data
@ConfigurationProperties(prefix = "combat")
public class CombatProperties {

    private Ws ws = new Ws();

    /** 每场战斗保留的日志条数，握手快照中下发 */
    private int messageLogSize = 50;

    @Data
    public static class Ws {
        /** 战斗 WebSocket 端点路径 */
        private String path = "/ws/combat";
        /** 允许的来源（Origin 模式），为空则只允许同源 */
        private List<String> allowedOrigins = new ArrayList<>();
        /** 单连接发送缓冲上限（字节） */
        private int sendBufferSizeLimit = 512 * 1024;
        /** 单次发送超时（毫秒） */
        private int sendTimeLimit = 10_000;
    }
}
