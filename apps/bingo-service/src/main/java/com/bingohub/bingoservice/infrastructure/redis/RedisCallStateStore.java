package com.bingohub.bingoservice.infrastructure.redis;

import com.bingohub.realtime.store.CallStateStore;
import com.bingohub.realtime.store.StoredCallState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 基于 Redis 的叫号状态存储。
 * - Key：bingo:session:{sessionId}:calls-state
 * - Value：StoredCallState（JSON）
 * - TTL：bingo.store.ttl-hours，每次写入刷新
 *
 * Redis 调用是阻塞的，统一放到 store-io 线程池执行，避免占用事件循环线程。
 */
@Slf4j
@Repository
public class RedisCallStateStore implements CallStateStore {

    private final RedisOps redis;
    private final Executor io;
    private final Duration ttl;

    public RedisCallStateStore(RedisOps redis,
                               @Qualifier("bingoStoreExecutor") Executor io,
                               @Value("${bingo.store.ttl-hours:24}") long ttlHours) {
        this.redis = redis;
        this.io = io;
        this.ttl = Duration.ofHours(ttlHours);
    }

    @Override
    public CompletableFuture<Optional<StoredCallState>> get(String sessionId) {
        return CompletableFuture.supplyAsync(
                () -> Optional.ofNullable(redis.get(RedisKeys.callState(sessionId), StoredCallState.class)), io);
    }

    @Override
    public CompletableFuture<Void> put(String sessionId, StoredCallState state) {
        return CompletableFuture.runAsync(() -> {
            redis.setEx(RedisKeys.callState(sessionId), state, ttl);
            log.debug("叫号状态已写入: session={}, generation={}, count={}",
                    sessionId, state.getGeneration(), state.getCalledNumbers().size());
        }, io);
    }
}
