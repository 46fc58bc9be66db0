package com.bingohub.bingoservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Arrays;

/**
 * 公用 Redis 工具类：
 * - 仅提供“原语级”方法；业务键名放在 RedisKeys，组织逻辑放在 Repo/Store 层
 * - 发布（pub/sub）也从这里走，便于统一替换
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：用于 pub/sub 与轻量 String 操作 */
    private final StringRedisTemplate strRedis;

    // -------------- String --------------
    /**
     * 写入键值（带 TTL）
     */
    public boolean setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
        return true;
    }

    /**
     * 获取键值并自动反序列化为指定类型
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return (v == null) ? null : (T) v;
    }

    // -------------- Key & TTL --------------
    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }

    // -------------- Pub/Sub --------------
    /**
     * 发布消息到频道
     * @return 收到消息的订阅者数量
     */
    public Long publish(String channel, String message) {
        return strRedis.convertAndSend(channel, message);
    }

    /**
     * 探活（PING），失败时抛出 DataAccessException
     */
    public String ping() {
        return strRedis.execute((RedisCallback<String>) RedisConnection::ping);
    }
}
