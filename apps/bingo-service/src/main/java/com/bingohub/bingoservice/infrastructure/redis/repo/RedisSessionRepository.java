package com.bingohub.bingoservice.infrastructure.redis.repo;

import com.bingohub.bingoservice.caller.domain.Session;
import com.bingohub.bingoservice.caller.domain.repository.SessionRepository;
import com.bingohub.bingoservice.infrastructure.redis.RedisKeys;
import com.bingohub.bingoservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * RedisSessionRepository
 * -------------------------------------------------------
 * 会话元信息的 Redis 仓储实现。
 * - 仅做数据映射与 TTL 管理，不承载业务规则；
 * - 键名通过 RedisKeys 统一生成。
 */
@Repository
@RequiredArgsConstructor
public class RedisSessionRepository implements SessionRepository {

    private final RedisOps ops;

    /**
     * 保存会话元信息（JSON 存储，带 TTL）
     */
    @Override
    public void save(Session session, Duration ttl) {
        ops.setEx(RedisKeys.session(session.getSessionId()), session, ttl);
    }

    @Override
    public Optional<Session> get(String sessionId) {
        return Optional.ofNullable(ops.get(RedisKeys.session(sessionId), Session.class));
    }

    @Override
    public void delete(String sessionId) {
        ops.del(RedisKeys.session(sessionId));
    }
}
