package com.bingohub.bingoservice.platform.loop;

import com.bingohub.realtime.connection.BackoffPolicy;
import com.bingohub.realtime.connection.BroadcastTransport;
import com.bingohub.realtime.connection.ConnectionManager;
import com.bingohub.realtime.connection.ConnectionSettings;
import com.bingohub.realtime.loop.ScheduledEventLoop;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RealtimeConfig
 * -------------------------------------------------------
 * 实时核心的装配：事件循环、阻塞 IO 线程池、连接参数与连接管理器。
 * -------------------------------------------------------
 * 说明：
 *  - 所有会话共用一个单线程事件循环（bingo-loop），状态只在该线程上修改；
 *  - Redis 读写与发布是阻塞调用，放到 store-io 线程池，完成后再切回事件循环；
 *  - 两个线程池与 AI/倒计时调度器分开，避免相互影响实时性。
 */
@Configuration
public class RealtimeConfig {

    @Bean(destroyMethod = "close")
    public ScheduledEventLoop bingoEventLoop() {
        return new ScheduledEventLoop("bingo-loop");
    }

    @Bean(name = "bingoStoreExecutor", destroyMethod = "shutdown")
    public ExecutorService bingoStoreExecutor(@Value("${bingo.store.io-threads:4}") int threads) {
        return Executors.newFixedThreadPool(Math.max(1, threads), new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "store-io-" + idx.getAndIncrement());
                // 设置为守护线程
                t.setDaemon(true);
                return t;
            }
        });
    }

    @Bean
    public ConnectionSettings connectionSettings(
            @Value("${bingo.connection.base-delay-ms:1000}") long baseMs,
            @Value("${bingo.connection.max-delay-ms:10000}") long maxMs,
            @Value("${bingo.connection.max-attempts:10}") int maxAttempts,
            @Value("${bingo.connection.heartbeat-interval-ms:30000}") long heartbeatMs,
            @Value("${bingo.connection.liveness-timeout-ms:75000}") long livenessMs,
            @Value("${bingo.channel.prefix:bingo:v1}") String channelPrefix) {
        return new ConnectionSettings(new BackoffPolicy(baseMs, maxMs, maxAttempts), heartbeatMs, livenessMs, channelPrefix);
    }

    @Bean(destroyMethod = "close")
    public ConnectionManager connectionManager(BroadcastTransport transport,
                                               ScheduledEventLoop bingoEventLoop,
                                               ConnectionSettings settings) {
        return new ConnectionManager(transport, bingoEventLoop, settings);
    }
}
