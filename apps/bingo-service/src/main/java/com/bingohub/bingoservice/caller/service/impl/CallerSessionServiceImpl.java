package com.bingohub.bingoservice.caller.service.impl;

import com.bingohub.bingoservice.caller.domain.Session;
import com.bingohub.bingoservice.caller.domain.SessionStatus;
import com.bingohub.bingoservice.caller.domain.repository.SessionRepository;
import com.bingohub.bingoservice.caller.service.CallerRuntime;
import com.bingohub.bingoservice.caller.service.CallerSessionService;
import com.bingohub.claimkafkanotifier.publisher.ClaimResolutionPublisher;
import com.bingohub.realtime.claim.CallerClaimProtocol;
import com.bingohub.realtime.claim.ClaimResolution;
import com.bingohub.realtime.claim.ClaimView;
import com.bingohub.realtime.claim.GroupView;
import com.bingohub.realtime.claim.PrizeAllocation;
import com.bingohub.realtime.claim.Ticket;
import com.bingohub.realtime.claim.WinPattern;
import com.bingohub.realtime.connection.ConnectionManager;
import com.bingohub.realtime.connection.ConnectionStatus;
import com.bingohub.realtime.connection.SessionConnection;
import com.bingohub.realtime.error.TransportException;
import com.bingohub.realtime.loop.EventLoop;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.ClaimSubmittedPayload;
import com.bingohub.realtime.protocol.payload.TicketSnapshot;
import com.bingohub.realtime.store.CallStateStore;
import com.bingohub.realtime.sync.CallResult;
import com.bingohub.realtime.sync.CallState;
import com.bingohub.realtime.sync.CallSyncEngine;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 叫号方会话服务实现
 * -------------------------------------------------------
 * Responsibilities:
 *  - 会话元信息落 Redis（SessionRepository），运行态（连接/引擎/判定）只在内存；
 *  - 进程重启后，ACTIVE 会话在首次访问时按需重建运行态，叫号序列从存储恢复；
 *  - 所有异步结果在此处同步等待，异常原样抛给 Web 层统一映射。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallerSessionServiceImpl implements CallerSessionService {

    private static final Duration SESSION_TTL = Duration.ofHours(24);

    // ====== 内存运行态表 ======
    private final Map<String, CallerRuntime> runtimes = new ConcurrentHashMap<>();

    private final SessionRepository sessionRepo;
    private final CallStateStore store;
    private final ConnectionManager connectionManager;
    private final EventLoop loop;

    /** Kafka 通知为可选组件：未配置 claim.kafka.bootstrap-servers 时不存在 */
    private ObjectProvider<ClaimResolutionPublisher> publisherProvider;

    @Autowired
    public void setPublisherProvider(ObjectProvider<ClaimResolutionPublisher> publisherProvider) {
        this.publisherProvider = publisherProvider;
    }

    /** 并列声明合并窗口（毫秒） */
    @Value("${bingo.claim.coalescing-window-ms:3000}")
    private long coalescingWindowMs;

    /** 等待事件循环结果的上限（毫秒） */
    @Value("${bingo.api.await-timeout-ms:5000}")
    private long awaitTimeoutMs;

    // ------------------------------------------------------------------
    // 会话生命周期
    // ------------------------------------------------------------------

    @Override
    public Session open(String sessionId, String callerId, String gameType, WinPattern initialPattern) {
        Validate.notBlank(sessionId, "sessionId 不能为空");
        Validate.notBlank(callerId, "callerId 不能为空");
        Session session = sessionRepo.get(sessionId).orElse(null);
        if (session != null && session.getStatus() == SessionStatus.ACTIVE) {
            if (!callerId.equals(session.getCallerId())) {
                throw new IllegalStateException("会话已由其他叫号方开启: " + sessionId);
            }
            log.debug("会话已开启，直接返回: session={}", sessionId);
        } else {
            long now = loop.now();
            session = Session.builder()
                    .sessionId(sessionId)
                    .gameType(gameType)
                    .callerId(callerId)
                    .status(SessionStatus.ACTIVE)
                    .coalescingWindowMs(coalescingWindowMs)
                    .createdAt(session == null ? now : session.getCreatedAt())
                    .build();
            sessionRepo.save(session, SESSION_TTL);
            log.info("开启会话: session={}, caller={}, gameType={}", sessionId, callerId, gameType);
        }
        CallerRuntime rt = runtimeOf(session);
        await(rt.callSync().ensureLoaded());
        if (initialPattern != null) {
            await(rt.callSync().changeWinPattern(initialPattern));
        }
        return session;
    }

    @Override
    public Session end(String sessionId) {
        Session session = requireSession(sessionId);
        CallerRuntime rt = runtimes.remove(sessionId);
        if (rt != null) {
            rt.stop();
        }
        connectionManager.release(sessionId);
        if (session.getStatus() != SessionStatus.ENDED) {
            session.setStatus(SessionStatus.ENDED);
            session.setEndedAt(loop.now());
            sessionRepo.save(session, SESSION_TTL);
            log.info("结束会话: session={}", sessionId);
        }
        return session;
    }

    @Override
    public Session getSession(String sessionId) {
        return requireSession(sessionId);
    }

    // ------------------------------------------------------------------
    // 叫号写路径
    // ------------------------------------------------------------------

    @Override
    public CallResult callNumber(String sessionId, int number) {
        return await(activeRuntime(sessionId).callSync().callNumber(number));
    }

    @Override
    public CallState resetGame(String sessionId) {
        return await(activeRuntime(sessionId).callSync().resetGame());
    }

    @Override
    public CallState changePattern(String sessionId, WinPattern pattern) {
        Validate.notNull(pattern, "pattern 不能为空");
        return await(activeRuntime(sessionId).callSync().changeWinPattern(pattern));
    }

    @Override
    public CallState state(String sessionId) {
        requireSession(sessionId);
        return await(store.get(sessionId))
                .map(s -> s.toCallState(sessionId))
                .orElseGet(() -> CallState.initial(sessionId));
    }

    @Override
    public ConnectionStatus connectionStatus(String sessionId) {
        requireSession(sessionId);
        return connectionManager.status(sessionId);
    }

    // ------------------------------------------------------------------
    // 声明
    // ------------------------------------------------------------------

    @Override
    public List<ClaimView> claims(String sessionId) {
        return await(activeRuntime(sessionId).claims().listClaims());
    }

    @Override
    public List<GroupView> groups(String sessionId) {
        return await(activeRuntime(sessionId).claims().listGroups());
    }

    @Override
    public ClaimResolution decide(String sessionId, String groupId, PrizeAllocation allocation) {
        return await(activeRuntime(sessionId).claims().decide(groupId, allocation));
    }

    @Override
    public ClaimView reject(String sessionId, String claimId, String reason) {
        return await(activeRuntime(sessionId).claims().rejectClaim(claimId, reason));
    }

    @Override
    public String submitClaim(String sessionId, String playerId, String playerName,
                              TicketSnapshot ticket, WinPattern pattern) {
        Validate.notBlank(playerId, "playerId 不能为空");
        Validate.notNull(pattern, "pattern 不能为空");
        // 先在入口校验票面结构，避免把无效数据广播出去
        Ticket.fromSnapshot(ticket);
        CallerRuntime rt = activeRuntime(sessionId);
        String claimId = UUID.randomUUID().toString();
        ClaimSubmittedPayload payload = new ClaimSubmittedPayload(claimId, playerId,
                StringUtils.defaultIfBlank(playerName, playerId), sessionId, ticket, pattern.id(),
                loop.now(), rt.callSync().currentState().generation());
        await(rt.connection().publish(EventType.CLAIM_SUBMITTED, payload));
        log.info("代玩家提交声明: session={}, player={}, claim={}, pattern={}", sessionId, playerId, claimId, pattern.id());
        return claimId;
    }

    @PreDestroy
    public void shutdown() {
        runtimes.values().forEach(CallerRuntime::stop);
        runtimes.clear();
    }

    // ------------------------------------------------------------------
    // 内部
    // ------------------------------------------------------------------

    private Session requireSession(String sessionId) {
        return sessionRepo.get(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("会话不存在: " + sessionId));
    }

    private CallerRuntime activeRuntime(String sessionId) {
        Session session = requireSession(sessionId);
        if (session.getStatus() == SessionStatus.PENDING) {
            throw new IllegalStateException("会话尚未开启: " + sessionId);
        }
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw new IllegalStateException("会话已结束: " + sessionId);
        }
        return runtimeOf(session);
    }

    /**
     * 取（或重建）会话运行态。重建时叫号引擎从存储加载权威状态，
     * 重启前未判定完的声明不恢复，玩家需重新提交。
     */
    private CallerRuntime runtimeOf(Session session) {
        return runtimes.computeIfAbsent(session.getSessionId(), id -> {
            SessionConnection conn = connectionManager.connect(id);
            CallSyncEngine callSync = CallSyncEngine.caller(conn, store, loop);
            callSync.start();
            long window = session.getCoalescingWindowMs() > 0 ? session.getCoalescingWindowMs() : coalescingWindowMs;
            CallerClaimProtocol claims = new CallerClaimProtocol(conn, callSync, loop, window);
            claims.start();
            if (publisherProvider != null) {
                publisherProvider.ifAvailable(publisher -> claims.onClaimResolved(publisher::publish));
            }
            log.info("会话运行态已创建: session={}, window={}ms", id, window);
            return new CallerRuntime(conn, callSync, claims);
        });
    }

    /**
     * 同步等待异步结果；业务异常原样抛出，超时转为 TransportException。
     */
    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(awaitTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new TransportException("操作失败: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransportException("等待超时（" + awaitTimeoutMs + "ms）", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("等待被中断", e);
        }
    }
}
