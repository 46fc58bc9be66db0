package com.bingohub.realtime.connection;

import com.bingohub.realtime.error.TransportException;
import com.bingohub.realtime.loop.EventLoop;
import com.bingohub.realtime.loop.EventLoop.ScheduledTask;
import com.bingohub.realtime.protocol.BingoChannels;
import com.bingohub.realtime.protocol.ChannelKind;
import com.bingohub.realtime.protocol.EventCodec;
import com.bingohub.realtime.protocol.EventEnvelope;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.HeartbeatPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SessionConnection
 * -------------------------------------------------------
 * 单个会话的逻辑连接（每进程每会话仅一个，由 {@link ConnectionManager} 创建）。
 * -------------------------------------------------------
 * Responsibilities:
 *  - 在 calls / claims 两个频道上收发 v1 事件外壳；
 *  - 维护 ConnectionState，并在每次迁移时通知监听者；
 *  - 传输失败时按指数退避重连，达到上限后进入 ERROR，直到显式 reconnect；
 *  - 已连接时按固定间隔发送心跳；超过 livenessTimeout 没有收到任何消息（含自身心跳回显）即强制断开。
 * -------------------------------------------------------
 * 线程模型：
 *  - 所有状态只在事件循环上修改；传输回调先 loop.execute 再处理；
 *  - status() 读取 volatile 快照，可在任意线程调用。
 */
public class SessionConnection {

    private static final Logger log = LoggerFactory.getLogger(SessionConnection.class);

    private final String sessionId;
    private final BroadcastTransport transport;
    private final EventLoop loop;
    private final ConnectionSettings settings;
    private final Runnable onClose;

    private final String callsChannel;
    private final String claimsChannel;

    // 事件类型 -> 处理器（按注册顺序调用）
    private final Map<EventType, List<Subscription>> handlers = new EnumMap<>(EventType.class);
    private final List<ConnectionStatusListener> statusListeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionStatus status = ConnectionStatus.initial();

    // 以下字段只在事件循环上访问
    private ScheduledTask retryTask;
    private ScheduledTask heartbeatTask;
    private long lastActivityAt;
    // 每次发起连接自增；回调携带的序号不一致说明该次尝试已被取消
    private long attemptSeq;
    private boolean manuallyDisconnected;
    private volatile boolean closed;

    SessionConnection(String sessionId,
                      BroadcastTransport transport,
                      EventLoop loop,
                      ConnectionSettings settings,
                      Runnable onClose) {
        this.sessionId = sessionId;
        this.transport = transport;
        this.loop = loop;
        this.settings = settings;
        this.onClose = onClose;
        this.callsChannel = BingoChannels.of(settings.channelPrefix(), sessionId, ChannelKind.CALLS);
        this.claimsChannel = BingoChannels.of(settings.channelPrefix(), sessionId, ChannelKind.CLAIMS);
        for (EventType type : EventType.values()) {
            handlers.put(type, new CopyOnWriteArrayList<>());
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public ConnectionStatus status() {
        return status;
    }

    /**
     * 首次建立连接（仅在 UNKNOWN 时生效）。
     */
    void start() {
        loop.execute(() -> {
            if (!closed && status.state() == ConnectionState.UNKNOWN) {
                beginConnect(0);
            }
        });
    }

    /**
     * 按事件类型订阅；同一类型可注册多个处理器，按注册顺序调用。
     */
    public Registration subscribe(EventType type, EventHandler handler) {
        Subscription sub = new Subscription(handler);
        handlers.get(type).add(sub);
        AtomicBoolean removed = new AtomicBoolean(false);
        return () -> {
            if (removed.compareAndSet(false, true)) {
                handlers.get(type).remove(sub);
            }
        };
    }

    /**
     * 订阅状态变化。
     */
    public Registration onStatusChange(ConnectionStatusListener listener) {
        statusListeners.add(listener);
        AtomicBoolean removed = new AtomicBoolean(false);
        return () -> {
            if (removed.compareAndSet(false, true)) {
                statusListeners.remove(listener);
            }
        };
    }

    /**
     * 发布事件。未连接时立即以 TransportException 失败，不排队。
     * 结果在事件循环上完成。
     */
    public CompletableFuture<Void> publish(EventType type, Object payload) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (closed) {
            result.completeExceptionally(new TransportException("连接已关闭: session=" + sessionId));
            return result;
        }
        if (!status.isConnected()) {
            result.completeExceptionally(new TransportException(
                    "连接不可用(" + status.state().wire() + ")，无法发布 " + type.wire()));
            return result;
        }
        String message = EventCodec.encode(EventEnvelope.of(type, sessionId, payload, loop.now()));
        sendRaw(channelOf(type), message).whenComplete((v, ex) -> loop.execute(() -> {
            if (ex == null) {
                result.complete(null);
            } else {
                result.completeExceptionally(asTransportError(ex));
            }
        }));
        return result;
    }

    /**
     * 显式重连：取消挂起的重试，清零重试计数后立即连接（ERROR 状态下唯一的恢复方式）。
     */
    public void reconnect() {
        loop.execute(() -> {
            if (closed) {
                return;
            }
            log.info("显式重连: session={}, state={}", sessionId, status.state().wire());
            manuallyDisconnected = false;
            cancelRetry();
            stopHeartbeat();
            closeChannels();
            beginConnect(0);
        });
    }

    /**
     * 显式断开：取消重连与心跳，不再自动重试（可再 reconnect）。
     */
    public void disconnect() {
        loop.execute(() -> {
            if (closed) {
                return;
            }
            manuallyDisconnected = true;
            attemptSeq++;
            cancelRetry();
            stopHeartbeat();
            closeChannels();
            transition(ConnectionState.DISCONNECTED, 0, 0L);
        });
    }

    /**
     * 永久关闭：断开并从 ConnectionManager 注销，清空所有订阅。
     */
    public void close() {
        loop.execute(() -> {
            if (closed) {
                return;
            }
            manuallyDisconnected = true;
            attemptSeq++;
            cancelRetry();
            stopHeartbeat();
            closeChannels();
            transition(ConnectionState.DISCONNECTED, 0, 0L);
            closed = true;
            handlers.values().forEach(List::clear);
            statusListeners.clear();
            onClose.run();
            log.info("会话连接已关闭: session={}", sessionId);
        });
    }

    // ------------------------------------------------------------------
    // 连接 / 重连
    // ------------------------------------------------------------------

    private void beginConnect(int retryCount) {
        long seq = ++attemptSeq;
        transition(ConnectionState.CONNECTING, retryCount, 0L);
        BroadcastTransport.Listener listener = new TransportListener(seq);
        CompletableFuture<Void> opened;
        try {
            opened = CompletableFuture.allOf(
                    transport.open(callsChannel, listener),
                    transport.open(claimsChannel, listener));
        } catch (RuntimeException e) {
            opened = CompletableFuture.failedFuture(e);
        }
        opened.whenComplete((v, ex) -> loop.execute(() -> onConnectResult(seq, ex)));
    }

    private void onConnectResult(long seq, Throwable ex) {
        if (closed || seq != attemptSeq) {
            return;
        }
        if (ex == null) {
            markActivity();
            transition(ConnectionState.CONNECTED, 0, 0L);
            startHeartbeat();
            return;
        }
        log.warn("连接失败: session={}, retryCount={}, cause={}", sessionId, status.retryCount(), rootMessage(ex));
        handleFailure(ex);
    }

    /**
     * 失败处理：未达上限则 DISCONNECTED + 安排下一次重试；达到上限则 ERROR。
     */
    private void handleFailure(Throwable cause) {
        stopHeartbeat();
        closeChannels();
        attemptSeq++;
        if (manuallyDisconnected) {
            transition(ConnectionState.DISCONNECTED, 0, 0L);
            return;
        }
        BackoffPolicy backoff = settings.backoff();
        int attempt = status.retryCount();
        if (attempt >= backoff.maxAttempts()) {
            log.error("重连次数已耗尽，进入 error: session={}, attempts={}, cause={}",
                    sessionId, attempt, rootMessage(cause));
            transition(ConnectionState.ERROR, attempt, 0L);
            return;
        }
        long delay = backoff.delayFor(attempt);
        transition(ConnectionState.DISCONNECTED, attempt + 1, loop.now() + delay);
        cancelRetry();
        retryTask = loop.schedule(this::retry, delay);
        log.info("已安排重连: session={}, retry={}, delayMs={}", sessionId, attempt + 1, delay);
    }

    private void retry() {
        retryTask = null;
        if (closed || manuallyDisconnected || status.state() != ConnectionState.DISCONNECTED) {
            return;
        }
        beginConnect(status.retryCount());
    }

    private void onTransportDropped(long seq, String channel, Throwable cause) {
        if (closed || seq != attemptSeq || status.state() != ConnectionState.CONNECTED) {
            return;
        }
        log.warn("传输断开: session={}, channel={}, cause={}", sessionId, channel, rootMessage(cause));
        handleFailure(cause);
    }

    // ------------------------------------------------------------------
    // 心跳 / 存活检测
    // ------------------------------------------------------------------

    private void startHeartbeat() {
        stopHeartbeat();
        long interval = settings.heartbeatIntervalMs();
        heartbeatTask = loop.scheduleAtFixedRate(this::heartbeatTick, interval, interval);
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel();
            heartbeatTask = null;
        }
    }

    private void heartbeatTick() {
        if (closed || status.state() != ConnectionState.CONNECTED) {
            return;
        }
        long silentFor = loop.now() - lastActivityAt;
        if (silentFor > settings.livenessTimeoutMs()) {
            log.warn("心跳超时，强制断开: session={}, silentMs={}", sessionId, silentFor);
            handleFailure(new TransportException("超过 " + settings.livenessTimeoutMs() + "ms 无传输活动"));
            return;
        }
        // 心跳经订阅回显到本连接，收到即视为存活；发送成功本身不算活动
        String message = EventCodec.encode(EventEnvelope.of(
                EventType.HEARTBEAT, sessionId, new HeartbeatPayload(sessionId, loop.now()), loop.now()));
        sendRaw(callsChannel, message).whenComplete((v, ex) -> {
            if (ex != null) {
                log.debug("心跳发送失败: session={}, cause={}", sessionId, rootMessage(ex));
            }
        });
    }

    private void markActivity() {
        lastActivityAt = loop.now();
    }

    // ------------------------------------------------------------------
    // 收消息
    // ------------------------------------------------------------------

    private void dispatch(long seq, String raw) {
        if (closed || seq != attemptSeq) {
            return;
        }
        markActivity();
        EventEnvelope env = EventCodec.decode(raw).orElse(null);
        if (env == null) {
            return;
        }
        if (!sessionId.equals(env.getSessionId())) {
            log.warn("收到其他会话的事件，已丢弃: expected={}, actual={}", sessionId, env.getSessionId());
            return;
        }
        for (Subscription sub : handlers.get(env.eventType())) {
            try {
                sub.handler().onEvent(env);
            } catch (RuntimeException e) {
                log.error("事件处理器执行失败: session={}, type={}", sessionId, env.getType(), e);
            }
        }
    }

    // ------------------------------------------------------------------
    // 工具
    // ------------------------------------------------------------------

    private void transition(ConnectionState state, int retryCount, long nextRetryAt) {
        ConnectionStatus previous = status;
        ConnectionStatus next = new ConnectionStatus(state, retryCount, nextRetryAt);
        if (previous.equals(next)) {
            return;
        }
        status = next;
        log.info("连接状态变化: session={}, {} -> {}, retryCount={}",
                sessionId, previous.state().wire(), state.wire(), retryCount);
        for (ConnectionStatusListener l : statusListeners) {
            try {
                l.onStatusChanged(previous, next);
            } catch (RuntimeException e) {
                log.error("状态监听器执行失败: session={}", sessionId, e);
            }
        }
    }

    private CompletableFuture<Void> sendRaw(String channel, String message) {
        try {
            return transport.publish(channel, message);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void closeChannels() {
        try {
            transport.close(callsChannel);
            transport.close(claimsChannel);
        } catch (RuntimeException e) {
            log.debug("关闭频道失败: session={}, cause={}", sessionId, e.getMessage());
        }
    }

    private void cancelRetry() {
        if (retryTask != null) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    private String channelOf(EventType type) {
        return type.channel() == ChannelKind.CALLS ? callsChannel : claimsChannel;
    }

    private static TransportException asTransportError(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause instanceof TransportException te ? te : new TransportException("发布失败: " + cause.getMessage(), cause);
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    /**
     * 包一层，保证同一处理器重复注册时各自独立注销。
     */
    private record Subscription(EventHandler handler) {
        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(this);
        }
    }

    /**
     * 绑定到某一次连接尝试的传输回调。
     */
    private final class TransportListener implements BroadcastTransport.Listener {
        private final long seq;

        private TransportListener(long seq) {
            this.seq = seq;
        }

        @Override
        public void onMessage(String channel, String message) {
            loop.execute(() -> dispatch(seq, message));
        }

        @Override
        public void onDropped(String channel, Throwable cause) {
            loop.execute(() -> onTransportDropped(seq, channel, cause));
        }
    }
}
