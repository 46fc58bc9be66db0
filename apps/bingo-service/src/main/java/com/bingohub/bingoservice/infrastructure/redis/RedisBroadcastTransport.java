package com.bingohub.bingoservice.infrastructure.redis;

import com.bingohub.realtime.connection.BroadcastTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * RedisBroadcastTransport
 * -------------------------------------------------------
 * 用 Redis pub/sub 实现广播传输。
 * -------------------------------------------------------
 * Responsibilities:
 *  - open：向订阅容器登记频道监听，并 PING 一次确认 Redis 可达；
 *  - publish：异步 PUBLISH 已编码的事件；
 *  - close：移除频道监听。
 * -------------------------------------------------------
 * 说明：
 *  - 订阅容器自身会在连接恢复后重新订阅；单条订阅掉线不单独回报，
 *    由 SessionConnection 的心跳存活检测发现并触发重连；
 *  - 重复 open 同一频道时替换旧监听。
 */
@Slf4j
@Component
public class RedisBroadcastTransport implements BroadcastTransport {

    private final RedisMessageListenerContainer container;
    private final RedisOps redis;
    private final Executor io;

    private final Map<String, MessageListener> listeners = new ConcurrentHashMap<>();

    public RedisBroadcastTransport(RedisMessageListenerContainer container,
                                   RedisOps redis,
                                   @Qualifier("bingoStoreExecutor") Executor io) {
        this.container = container;
        this.redis = redis;
        this.io = io;
    }

    @Override
    public CompletableFuture<Void> open(String channel, Listener listener) {
        MessageListener ml = (message, pattern) ->
                listener.onMessage(channel, new String(message.getBody(), StandardCharsets.UTF_8));
        MessageListener previous = listeners.put(channel, ml);
        if (previous != null) {
            container.removeMessageListener(previous, new ChannelTopic(channel));
        }
        container.addMessageListener(ml, new ChannelTopic(channel));
        return CompletableFuture.runAsync(() -> {
            redis.ping();
            log.debug("已订阅频道: {}", channel);
        }, io);
    }

    @Override
    public CompletableFuture<Void> publish(String channel, String message) {
        return CompletableFuture.runAsync(() -> redis.publish(channel, message), io);
    }

    @Override
    public void close(String channel) {
        MessageListener ml = listeners.remove(channel);
        if (ml != null) {
            container.removeMessageListener(ml, new ChannelTopic(channel));
            log.debug("已取消订阅频道: {}", channel);
        }
    }
}
