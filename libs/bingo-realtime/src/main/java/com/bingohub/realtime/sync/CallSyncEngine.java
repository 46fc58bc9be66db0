package com.bingohub.realtime.sync;

import com.bingohub.realtime.cache.CachedCallState;
import com.bingohub.realtime.cache.LocalCache;
import com.bingohub.realtime.claim.WinPattern;
import com.bingohub.realtime.connection.ConnectionState;
import com.bingohub.realtime.connection.ConnectionStatus;
import com.bingohub.realtime.connection.Registration;
import com.bingohub.realtime.connection.SessionConnection;
import com.bingohub.realtime.error.PersistenceException;
import com.bingohub.realtime.error.StaleStateException;
import com.bingohub.realtime.loop.EventLoop;
import com.bingohub.realtime.protocol.EventEnvelope;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.GameResetPayload;
import com.bingohub.realtime.protocol.payload.NumberCalledPayload;
import com.bingohub.realtime.protocol.payload.PatternChangedPayload;
import com.bingohub.realtime.store.CallStateStore;
import com.bingohub.realtime.store.StoredCallState;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * CallSyncEngine
 * -------------------------------------------------------
 * 单会话的叫号同步引擎，叫号方与玩家各持一个实例（SyncRole 区分）。
 * -------------------------------------------------------
 * 叫号方（唯一写入方）：
 *  - callNumber / resetGame / changeWinPattern 串行执行；
 *  - 先持久化、再提交内存、最后广播；持久化失败则不提交（PersistenceException）；
 *  - 重复号码为无操作，不广播。
 *
 * 玩家（只读投影），数据来源按优先级：
 *  1) 广播增量：立即应用；
 *  2) 连上/重连后全量拉取，修正断线期间漏掉的增量；
 *  3) 本地缓存：仅在前两者都不可用时使用，标记为 Stale 直到对齐。
 *
 * 对齐规则：
 *  - 拉取结果代数 ≥ 当前代数时整体替换；更旧的代数直接丢弃；
 *  - 同代且拉取结果是当前序列的严格前缀（请求发出后又收到了增量）时丢弃。
 * -------------------------------------------------------
 * 所有状态只在事件循环上修改；state 以 volatile 快照对外可读。
 */
public class CallSyncEngine {

    private static final Logger log = LoggerFactory.getLogger(CallSyncEngine.class);

    private final String sessionId;
    private final SyncRole role;
    private final SessionConnection connection;
    private final CallStateStore store;
    private final LocalCache cache;
    private final EventLoop loop;

    private final List<CallStateListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Registration> registrations = new ArrayList<>();

    private volatile SyncState state = SyncState.unknown();

    // 叫号方写操作串行化
    private CompletableFuture<?> writeTail = CompletableFuture.completedFuture(null);
    private boolean started;

    private CallSyncEngine(String sessionId,
                           SyncRole role,
                           SessionConnection connection,
                           CallStateStore store,
                           LocalCache cache,
                           EventLoop loop) {
        this.sessionId = Validate.notBlank(sessionId, "sessionId 不能为空");
        this.role = role;
        this.connection = Validate.notNull(connection, "connection");
        this.store = Validate.notNull(store, "store");
        this.cache = cache;
        this.loop = Validate.notNull(loop, "loop");
        Validate.isTrue(sessionId.equals(connection.sessionId()), "connection 不属于会话 %s", sessionId);
    }

    public static CallSyncEngine caller(SessionConnection connection, CallStateStore store, EventLoop loop) {
        return new CallSyncEngine(connection.sessionId(), SyncRole.CALLER, connection, store, null, loop);
    }

    public static CallSyncEngine player(SessionConnection connection, CallStateStore store, LocalCache cache, EventLoop loop) {
        Validate.notNull(cache, "cache");
        return new CallSyncEngine(connection.sessionId(), SyncRole.PLAYER, connection, store, cache, loop);
    }

    /**
     * 启动：玩家侧加载本地缓存、订阅广播与连接状态；叫号方无需订阅自己的广播。
     */
    public void start() {
        loop.execute(() -> {
            if (started) {
                return;
            }
            started = true;
            if (role == SyncRole.PLAYER) {
                startPlayer();
            }
        });
    }

    /**
     * 停止：注销所有订阅（连接本身由 ConnectionManager 管理）。
     */
    public void stop() {
        loop.execute(() -> {
            registrations.forEach(Registration::unsubscribe);
            registrations.clear();
            listeners.clear();
        });
    }

    // ------------------------------------------------------------------
    // 读
    // ------------------------------------------------------------------

    public String sessionId() {
        return sessionId;
    }

    public SyncRole role() {
        return role;
    }

    public SyncState syncState() {
        return state;
    }

    /**
     * 当前已叫号码（按叫号顺序）。尚无数据时返回空列表。
     */
    public List<Integer> getCalledNumbers() {
        return currentState().calledNumbers();
    }

    public List<Integer> getCalledNumbers(String sessionId) {
        Validate.isTrue(this.sessionId.equals(sessionId), "引擎只服务会话 %s", this.sessionId);
        return getCalledNumbers();
    }

    public CallState currentState() {
        SyncState s = state;
        if (s instanceof SyncState.Fresh fresh) {
            return fresh.data();
        }
        if (s instanceof SyncState.Stale stale) {
            return stale.data();
        }
        return CallState.initial(sessionId);
    }

    public boolean isFresh() {
        return state instanceof SyncState.Fresh;
    }

    public Registration onNumberCalled(NumberCalledHandler handler) {
        return addListener(new CallStateListener() {
            @Override
            public void onNumberCalled(int number, CallState state) {
                handler.onNumberCalled(number, state);
            }
        });
    }

    public Registration addListener(CallStateListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ------------------------------------------------------------------
    // 叫号方写路径
    // ------------------------------------------------------------------

    /**
     * 叫号。重复号码返回 DUPLICATE，状态不变、不广播。
     */
    public CompletableFuture<CallResult> callNumber(int number) {
        requireCaller();
        Validate.isTrue(number > 0, "号码必须为正整数: %s", number);
        return enqueueWrite(() -> ensureLoaded().thenCompose(current -> {
            if (current.contains(number)) {
                log.debug("重复叫号，忽略: session={}, number={}", sessionId, number);
                return CompletableFuture.completedFuture(new CallResult(CallResult.Outcome.DUPLICATE, current, false));
            }
            CallState next = current.append(number, loop.now());
            return persist(next).thenCompose(v -> {
                commit(next);
                log.info("叫号: session={}, gen={}, number={}, count={}",
                        sessionId, next.generation(), number, next.calledNumbers().size());
                notifyListeners(l -> l.onNumberCalled(number, next));
                NumberCalledPayload payload = new NumberCalledPayload(number, next.calledNumbers(), sessionId,
                        next.updatedAt(), next.generation());
                return publishQuietly(EventType.NUMBER_CALLED, payload)
                        .thenApply(published -> new CallResult(CallResult.Outcome.CALLED, next, published));
            });
        }));
    }

    /**
     * 重置本局：代数 + 1，清空序列，持久化后广播 game-reset。
     */
    public CompletableFuture<CallState> resetGame() {
        requireCaller();
        return enqueueWrite(() -> ensureLoaded().thenCompose(current -> {
            CallState next = current.reset(loop.now());
            return persist(next).thenCompose(v -> {
                commit(next);
                log.info("重置本局: session={}, gen {} -> {}", sessionId, current.generation(), next.generation());
                notifyListeners(l -> l.onGameReset(next));
                return publishQuietly(EventType.GAME_RESET, new GameResetPayload(sessionId, next.generation()))
                        .thenApply(published -> next);
            });
        }));
    }

    /**
     * 切换当前中奖图案，持久化后广播 pattern-changed。
     */
    public CompletableFuture<CallState> changeWinPattern(WinPattern pattern) {
        requireCaller();
        Validate.notNull(pattern, "pattern");
        return enqueueWrite(() -> ensureLoaded().thenCompose(current -> {
            if (pattern.id().equals(current.activePattern())) {
                return CompletableFuture.completedFuture(current);
            }
            CallState next = current.withPattern(pattern.id(), loop.now());
            return persist(next).thenCompose(v -> {
                commit(next);
                log.info("切换中奖图案: session={}, {} -> {}", sessionId, current.activePattern(), pattern.id());
                notifyListeners(l -> l.onPatternChanged(pattern.id(), next));
                PatternChangedPayload payload = new PatternChangedPayload(sessionId, pattern.id(), next.generation());
                return publishQuietly(EventType.PATTERN_CHANGED, payload).thenApply(published -> next);
            });
        }));
    }

    /**
     * 叫号方首次写入前从存储加载权威状态；无记录时从第 0 代开始。
     */
    public CompletableFuture<CallState> ensureLoaded() {
        if (state instanceof SyncState.Fresh fresh) {
            return CompletableFuture.completedFuture(fresh.data());
        }
        return safeGet().thenApplyAsync(found -> {
            if (state instanceof SyncState.Fresh fresh) {
                return fresh.data();
            }
            CallState loaded = found.map(s -> s.toCallState(sessionId)).orElseGet(() -> CallState.initial(sessionId));
            commit(loaded);
            log.info("加载叫号状态: session={}, gen={}, count={}", sessionId, loaded.generation(), loaded.calledNumbers().size());
            return loaded;
        }, loop);
    }

    private <T> CompletableFuture<T> enqueueWrite(Supplier<CompletableFuture<T>> op) {
        CompletableFuture<T> result = new CompletableFuture<>();
        loop.execute(() -> {
            CompletableFuture<T> next = writeTail
                    .handleAsync((v, ex) -> null, loop)
                    .thenCompose(ignored -> op.get());
            writeTail = next.handle((v, ex) -> null);
            next.whenComplete((v, ex) -> {
                if (ex == null) {
                    result.complete(v);
                } else {
                    result.completeExceptionally(unwrap(ex));
                }
            });
        });
        return result;
    }

    private CompletableFuture<Void> persist(CallState next) {
        CompletableFuture<Void> put;
        try {
            put = store.put(sessionId, StoredCallState.from(next));
        } catch (RuntimeException e) {
            put = CompletableFuture.failedFuture(e);
        }
        return put.handleAsync((v, ex) -> {
            if (ex != null) {
                Throwable cause = unwrap(ex);
                log.warn("持久化失败，本次操作未提交: session={}, gen={}, cause={}",
                        sessionId, next.generation(), cause.getMessage());
                throw cause instanceof PersistenceException pe ? pe
                        : new PersistenceException("写入叫号状态失败: session=" + sessionId, cause);
            }
            return null;
        }, loop);
    }

    private CompletableFuture<Boolean> publishQuietly(EventType type, Object payload) {
        return connection.publish(type, payload).handle((v, ex) -> {
            if (ex != null) {
                log.warn("广播失败（已持久化，玩家重连后补齐）: session={}, type={}, cause={}",
                        sessionId, type.wire(), unwrap(ex).getMessage());
                return false;
            }
            return true;
        });
    }

    private void requireCaller() {
        if (role != SyncRole.CALLER) {
            throw new IllegalStateException("仅叫号方可执行该操作");
        }
    }

    // ------------------------------------------------------------------
    // 玩家读路径
    // ------------------------------------------------------------------

    private void startPlayer() {
        cache.load(sessionId).ifPresent(cached -> {
            if (state instanceof SyncState.Unknown) {
                CallState data;
                try {
                    data = cached.toCallState(sessionId);
                } catch (IllegalArgumentException | NullPointerException e) {
                    log.warn("本地缓存内容非法，按缺失处理: session={}, cause={}", sessionId, e.getMessage());
                    cache.evict(sessionId);
                    return;
                }
                CallState offline = data;
                state = new SyncState.Stale(offline);
                log.debug("加载本地缓存（待对齐）: session={}, count={}", sessionId, offline.calledNumbers().size());
                notifyListeners(l -> l.onStateReplaced(offline, true));
            }
        });
        registrations.add(connection.subscribe(EventType.NUMBER_CALLED, this::onNumberCalledEvent));
        registrations.add(connection.subscribe(EventType.GAME_RESET, this::onGameResetEvent));
        registrations.add(connection.subscribe(EventType.PATTERN_CHANGED, this::onPatternChangedEvent));
        registrations.add(connection.onStatusChange((prev, cur) -> loop.execute(() -> onConnectionStatus(cur))));
        if (connection.status().isConnected()) {
            refreshQuietly();
        }
    }

    private void onConnectionStatus(ConnectionStatus current) {
        if (current.state() == ConnectionState.CONNECTED) {
            refreshQuietly();
        } else if (current.state() == ConnectionState.DISCONNECTED || current.state() == ConnectionState.ERROR) {
            if (state instanceof SyncState.Fresh fresh) {
                state = new SyncState.Stale(fresh.data());
            }
        }
    }

    /**
     * 全量拉取并对齐。被判定为过期的结果以 StaleStateException 完成。
     */
    public CompletableFuture<CallState> refresh() {
        return safeGet().thenApplyAsync(this::reconcile, loop);
    }

    private void refreshQuietly() {
        refresh().whenComplete((v, ex) -> {
            if (ex == null) {
                return;
            }
            Throwable cause = unwrap(ex);
            if (cause instanceof StaleStateException) {
                log.debug("过期的拉取结果已丢弃: session={}, {}", sessionId, cause.getMessage());
            } else {
                log.warn("拉取叫号状态失败，继续使用现有数据: session={}, cause={}", sessionId, cause.getMessage());
            }
        });
    }

    CallState reconcile(Optional<StoredCallState> fetched) {
        SyncState before = state;
        CallState current = currentState();
        if (fetched.isEmpty()) {
            if (before instanceof SyncState.Unknown) {
                CallState empty = CallState.initial(sessionId);
                state = new SyncState.Fresh(empty.generation(), empty);
                return empty;
            }
            log.debug("存储无记录，保留现有数据: session={}", sessionId);
            return current;
        }
        CallState incoming = fetched.get().toCallState(sessionId);
        boolean hasData = !(before instanceof SyncState.Unknown);
        if (hasData && incoming.generation() < current.generation()) {
            throw new StaleStateException(incoming.generation(), current.generation());
        }
        if (hasData && incoming.generation() == current.generation() && isStrictPrefix(incoming, current)) {
            state = new SyncState.Fresh(current.generation(), current);
            throw new StaleStateException(incoming.generation(), current.generation());
        }
        state = new SyncState.Fresh(incoming.generation(), incoming);
        saveCache(incoming);
        log.debug("全量对齐: session={}, gen={}, count={}", sessionId, incoming.generation(), incoming.calledNumbers().size());
        notifyListeners(l -> l.onStateReplaced(incoming, false));
        return incoming;
    }

    private void onNumberCalledEvent(EventEnvelope env) {
        NumberCalledPayload p = env.payloadAs(NumberCalledPayload.class);
        if (p == null || (p.getNumber() == null && p.getCalledNumbers() == null)) {
            log.warn("number-called 载荷缺少号码，已丢弃: session={}", sessionId);
            return;
        }
        SyncState before = state;
        CallState base = currentState();
        Long gen = p.getGeneration();
        boolean missedReset = false;
        if (gen != null && gen < base.generation()) {
            log.debug("旧代增量已丢弃: session={}, gen={}, current={}", sessionId, gen, base.generation());
            return;
        }
        if (gen != null && gen > base.generation()) {
            base = base.withGeneration(gen, loop.now());
            missedReset = true;
        }
        long ts = Math.max(p.getTimestamp(), loop.now());
        CallState next;
        boolean full = p.getCalledNumbers() != null && p.getCalledNumbers().size() >= base.calledNumbers().size();
        if (full) {
            next = base.withNumbers(p.getCalledNumbers(), ts);
        } else if (p.getNumber() != null) {
            next = base.append(p.getNumber(), ts);
        } else {
            return;
        }
        Integer number = p.getNumber() != null ? p.getNumber() : next.lastCalledNumber();
        boolean added = number != null && !base.contains(number) && next.contains(number);
        if (full || before instanceof SyncState.Fresh) {
            state = new SyncState.Fresh(next.generation(), next);
        } else {
            state = new SyncState.Stale(next);
        }
        saveCache(next);
        if (added) {
            notifyListeners(l -> l.onNumberCalled(number, next));
        } else if (!next.equals(base)) {
            notifyListeners(l -> l.onStateReplaced(next, !(state instanceof SyncState.Fresh)));
        }
        if (missedReset) {
            log.info("检测到漏掉的重置，重新拉取: session={}, gen={}", sessionId, gen);
            refreshQuietly();
        }
    }

    private void onGameResetEvent(EventEnvelope env) {
        GameResetPayload p = env.payloadAs(GameResetPayload.class);
        CallState current = currentState();
        Long gen = p == null ? null : p.getGeneration();
        if (gen != null && !(state instanceof SyncState.Unknown) && gen <= current.generation()) {
            log.debug("重复的重置事件已忽略: session={}, gen={}", sessionId, gen);
            return;
        }
        long nextGen = gen != null ? gen : current.generation() + 1;
        CallState next = current.withGeneration(nextGen, loop.now());
        state = new SyncState.Fresh(nextGen, next);
        saveCache(next);
        log.info("收到重置: session={}, gen={}", sessionId, nextGen);
        notifyListeners(l -> l.onGameReset(next));
        if (gen == null) {
            refreshQuietly();
        }
    }

    private void onPatternChangedEvent(EventEnvelope env) {
        PatternChangedPayload p = env.payloadAs(PatternChangedPayload.class);
        if (p == null || p.getPattern() == null) {
            return;
        }
        CallState current = currentState();
        if (p.getGeneration() != null && p.getGeneration() < current.generation()) {
            log.debug("旧代图案变更已丢弃: session={}, gen={}", sessionId, p.getGeneration());
            return;
        }
        CallState next = current.withPattern(p.getPattern(), loop.now());
        SyncState before = state;
        state = before instanceof SyncState.Fresh ? new SyncState.Fresh(next.generation(), next) : new SyncState.Stale(next);
        saveCache(next);
        notifyListeners(l -> l.onPatternChanged(p.getPattern(), next));
    }

    // ------------------------------------------------------------------
    // 工具
    // ------------------------------------------------------------------

    private void commit(CallState next) {
        state = new SyncState.Fresh(next.generation(), next);
    }

    private CompletableFuture<Optional<StoredCallState>> safeGet() {
        try {
            return store.get(sessionId);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void saveCache(CallState data) {
        if (cache != null) {
            cache.save(CachedCallState.from(data));
        }
    }

    private void notifyListeners(Consumer<CallStateListener> action) {
        for (CallStateListener l : listeners) {
            try {
                action.accept(l);
            } catch (RuntimeException e) {
                log.error("叫号监听器执行失败: session={}", sessionId, e);
            }
        }
    }

    private static boolean isStrictPrefix(CallState candidate, CallState of) {
        List<Integer> a = candidate.calledNumbers();
        List<Integer> b = of.calledNumbers();
        return a.size() < b.size() && b.subList(0, a.size()).equals(a);
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable cur = ex;
        while (cur instanceof CompletionException && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
