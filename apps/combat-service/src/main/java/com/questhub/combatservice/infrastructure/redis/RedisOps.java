package com.questhub.combatservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;

/**
 * Redis 原语封装：
 * - 只提供 JSON 对象读写、字符串读写、自增、删除等原语；
 * - 业务键名放在 {@link RedisKeys}，文档结构由 Repo 层组织。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** JSON 对象模板 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：计数器与索引 */
    private final StringRedisTemplate strRedis;

    // -------------- Object --------------

    public void set(String key, Object val) {
        redis.opsForValue().set(key, val);
    }

    /**
     * 读取并转换为指定类型；类型不符视为不存在
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? Optional.of(type.cast(v)) : Optional.empty();
    }

    // -------------- String --------------

    public void setString(String key, String val) {
        strRedis.opsForValue().set(key, val);
    }

    public Optional<String> getString(String key) {
        return Optional.ofNullable(strRedis.opsForValue().get(key));
    }

    /**
     * 自增（整数累加）
     * @return 新值
     */
    public long incr(String key) {
        Long v = strRedis.opsForValue().increment(key);
        return v == null ? 0L : v;
    }

    // -------------- Key --------------

    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    public long del(String... keys) {
        Long n = redis.delete(Arrays.asList(keys));
        return n == null ? 0L : n;
    }
}
