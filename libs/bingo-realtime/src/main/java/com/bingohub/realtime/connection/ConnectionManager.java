package com.bingohub.realtime.connection;

import com.bingohub.realtime.loop.EventLoop;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ConnectionManager
 * -------------------------------------------------------
 * 每进程持有一个实例，按 sessionId 管理逻辑连接。
 * - connect：同一会话重复调用返回同一个连接（幂等）；
 * - release：关闭并注销某会话的连接；
 * - close：关闭全部连接。
 * -------------------------------------------------------
 * 由调用方显式构造并注入到 CallSyncEngine / ClaimProtocol，不提供全局单例。
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final BroadcastTransport transport;
    private final EventLoop loop;
    private final ConnectionSettings settings;

    private final ConcurrentMap<String, SessionConnection> connections = new ConcurrentHashMap<>();

    public ConnectionManager(BroadcastTransport transport, EventLoop loop, ConnectionSettings settings) {
        this.transport = Validate.notNull(transport, "transport");
        this.loop = Validate.notNull(loop, "loop");
        this.settings = Validate.notNull(settings, "settings");
    }

    /**
     * 建立（或复用）会话连接。首次创建时立即发起连接。
     */
    public SessionConnection connect(String sessionId) {
        Validate.notBlank(sessionId, "sessionId 不能为空");
        boolean[] created = {false};
        SessionConnection conn = connections.computeIfAbsent(sessionId, id -> {
            created[0] = true;
            SessionConnection[] self = new SessionConnection[1];
            self[0] = new SessionConnection(id, transport, loop, settings, () -> connections.remove(id, self[0]));
            return self[0];
        });
        if (created[0]) {
            log.info("创建会话连接: session={}", sessionId);
            conn.start();
        }
        return conn;
    }

    public Optional<SessionConnection> find(String sessionId) {
        return Optional.ofNullable(connections.get(sessionId));
    }

    public ConnectionStatus status(String sessionId) {
        SessionConnection conn = connections.get(sessionId);
        return conn == null ? ConnectionStatus.initial() : conn.status();
    }

    /**
     * 先同步注销，再在事件循环上关闭；之后的 connect 一定拿到新连接。
     */
    public void release(String sessionId) {
        SessionConnection conn = connections.remove(sessionId);
        if (conn != null) {
            conn.close();
        }
    }

    public EventLoop loop() {
        return loop;
    }

    @Override
    public void close() {
        connections.values().forEach(SessionConnection::close);
    }
}
