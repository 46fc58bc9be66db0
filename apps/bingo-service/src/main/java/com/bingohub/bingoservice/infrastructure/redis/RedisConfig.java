package com.bingohub.bingoservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * 全局 Redis 连接、序列化与订阅容器配置
 * -------------------------------------------------------
 * Responsibilities:
 *  - 提供统一的 RedisTemplate 和 StringRedisTemplate Bean；
 *  - 配置序列化策略（Key: String，Value: JSON）；
 *  - 提供 pub/sub 订阅容器，供广播传输与 STOMP 转发共用。
 * -------------------------------------------------------
 * 使用说明：
 *  - RedisTemplate<String, Object>：存取叫号状态、会话元信息（自动 JSON 序列化）；
 *  - StringRedisTemplate：发布已编码的事件字符串。
 */
@Configuration
public class RedisConfig {

    /**
     * 通用 RedisTemplate（Key 为 String，Value 为任意对象，自动 JSON 序列化）
     * Value 使用 GenericJackson2JsonRedisSerializer，携带类型信息，读出时还原为原类型。
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }

    /**
     * pub/sub 订阅容器
     * -------------------------------------------------------
     * 连接断开后容器自行按 recoveryInterval 重新订阅；
     * 会话级的断线感知由 SessionConnection 的心跳存活检测负责。
     */
    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory factory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(factory);
        container.setRecoveryInterval(2000L);
        return container;
    }
}
