package com.bingohub.bingoservice.caller.domain.repository;

import com.bingohub.bingoservice.caller.domain.Session;

import java.time.Duration;
import java.util.Optional;

/**
 * 会话元信息仓储。
 */
public interface SessionRepository {

    void save(Session session, Duration ttl);

    Optional<Session> get(String sessionId);

    void delete(String sessionId);
}
