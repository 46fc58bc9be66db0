package com.bingohub.bingoservice.platform.ws;

import com.bingohub.realtime.connection.ConnectionSettings;
import com.bingohub.realtime.protocol.BingoChannels;
import com.bingohub.realtime.protocol.EventCodec;
import com.bingohub.realtime.protocol.EventEnvelope;
import com.bingohub.realtime.protocol.EventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * StompEventRelay
 * -------------------------------------------------------
 * 把 Redis 频道上的会话事件转发给浏览器玩家。
 * -------------------------------------------------------
 * Responsibilities:
 *  - 按通配模式订阅全部会话频道；
 *  - 解码外壳，丢弃无法识别的消息与心跳；
 *  - 原样推送外壳到 /topic/session.{sessionId}，浏览器按 type 分发。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompEventRelay implements MessageListener {

    static final String TOPIC_PREFIX = "/topic/session.";

    private final RedisMessageListenerContainer container;
    private final SimpMessagingTemplate messaging;
    private final ConnectionSettings settings;

    private PatternTopic topic;

    @PostConstruct
    public void subscribe() {
        topic = new PatternTopic(BingoChannels.allSessionsPattern(settings.channelPrefix()));
        container.addMessageListener(this, topic);
        log.info("STOMP 事件转发已启动: pattern={}", topic.getTopic());
    }

    @PreDestroy
    public void unsubscribe() {
        if (topic != null) {
            container.removeMessageListener(this, topic);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        relay(new String(message.getBody(), StandardCharsets.UTF_8));
    }

    /**
     * 转发一条已编码的事件。
     */
    void relay(String raw) {
        EventEnvelope env = EventCodec.decode(raw).orElse(null);
        if (env == null || env.getSessionId() == null) {
            log.debug("无法识别的频道消息，已丢弃");
            return;
        }
        if (env.eventType() == EventType.HEARTBEAT) {
            return;
        }
        messaging.convertAndSend(TOPIC_PREFIX + env.getSessionId(), env);
    }
}
