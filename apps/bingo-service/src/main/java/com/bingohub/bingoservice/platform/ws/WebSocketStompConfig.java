package com.bingohub.bingoservice.platform.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 浏览器玩家通过 /ws/bingo 连接，订阅 /topic/session.{sessionId} 接收叫号与判定事件，
 * 通过 /app 前缀发送声明。
 *
 * 用途：
 *   - /app/bingo.claim : 玩家提交声明
 *   - /topic/session.{sessionId} : 会话事件广播（由 StompEventRelay 从 Redis 转发）
 *   - /user/queue/claims、/user/queue/errors : 点对点回执与错误
 *
 * 同一客户端的推送保持发布顺序（setPreservePublishOrder），
 * 否则 clientOutboundChannel 的线程池可能让 number-called 乱序到达。
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    static final String ENDPOINT = "/ws/bingo";

    @Value("${bingo.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${bingo.ws.heartbeat-ms:5000}")
    private long heartbeatMs;

    /**
     * STOMP 心跳调度器。bean 名称与 Spring 自动配置的 taskScheduler 区分开。
     */
    @Bean(name = "bingoWsHeartbeatScheduler")
    public TaskScheduler bingoWsHeartbeatScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("bingo-ws-hb-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins);
        // 不支持原生 WebSocket 的浏览器走 SockJS
        registry.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins).withSockJS();
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs})
                .setTaskScheduler(bingoWsHeartbeatScheduler());
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
        registry.setPreservePublishOrder(true);
    }
}
