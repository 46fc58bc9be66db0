package com.bingohub.realtime.claim;

import com.bingohub.realtime.connection.Registration;
import com.bingohub.realtime.connection.SessionConnection;
import com.bingohub.realtime.loop.EventLoop;
import com.bingohub.realtime.protocol.EventEnvelope;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.ClaimCheckingPayload;
import com.bingohub.realtime.protocol.payload.ClaimResolvedPayload;
import com.bingohub.realtime.protocol.payload.ClaimSubmittedPayload;
import com.bingohub.realtime.sync.CallState;
import com.bingohub.realtime.sync.CallSyncEngine;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 玩家侧声明：提交声明，并根据叫号方广播的 claim-checking / claim-resolved 更新本地投影。
 * 同一票面、同一图案、同一代的声明在未失效前只提交一次。
 */
public class PlayerClaimProtocol {

    private static final Logger log = LoggerFactory.getLogger(PlayerClaimProtocol.class);

    private final String sessionId;
    private final SessionConnection connection;
    private final CallSyncEngine callSync;
    private final EventLoop loop;
    private final String playerId;
    private final String playerName;
    private final Supplier<String> idGenerator;

    private final Map<String, Claim> claims = new LinkedHashMap<>();
    private final Map<ClaimKey, Claim> claimsByKey = new HashMap<>();
    private final List<Registration> registrations = new ArrayList<>();
    private final List<Consumer<ClaimView>> resolvedHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<ClaimView>> updatedHandlers = new CopyOnWriteArrayList<>();

    public PlayerClaimProtocol(SessionConnection connection, CallSyncEngine callSync, EventLoop loop,
                               String playerId, String playerName) {
        this(connection, callSync, loop, playerId, playerName, () -> UUID.randomUUID().toString());
    }

    public PlayerClaimProtocol(SessionConnection connection, CallSyncEngine callSync, EventLoop loop,
                               String playerId, String playerName, Supplier<String> idGenerator) {
        this.sessionId = connection.sessionId();
        this.connection = connection;
        this.callSync = callSync;
        this.loop = loop;
        this.playerId = Validate.notBlank(playerId, "playerId 不能为空");
        this.playerName = playerName;
        this.idGenerator = idGenerator;
    }

    public void start() {
        loop.execute(() -> {
            if (!registrations.isEmpty()) {
                return;
            }
            registrations.add(connection.subscribe(EventType.CLAIM_CHECKING, this::onClaimChecking));
            registrations.add(connection.subscribe(EventType.CLAIM_RESOLVED, this::onClaimResolvedEvent));
        });
    }

    public void stop() {
        loop.execute(() -> {
            registrations.forEach(Registration::unsubscribe);
            registrations.clear();
        });
    }

    /**
     * 提交声明，返回处于 pending 的新声明；后续状态通过 onClaimUpdated / getClaim 获取。
     * - 同一票面/图案/代数已有进行中或已判定的声明时，直接返回已有声明，不重复广播；
     * - 广播失败时撤销本地登记，future 以 TransportException 失败，玩家可重试。
     */
    public CompletableFuture<ClaimView> submitClaim(Ticket ticket, WinPattern pattern) {
        Validate.notNull(ticket, "ticket");
        Validate.notNull(pattern, "pattern");
        CompletableFuture<ClaimView> result = new CompletableFuture<>();
        loop.execute(() -> {
            CallState seen = callSync.currentState();
            ClaimKey key = new ClaimKey(playerId, ticket.ticketId(), pattern, seen.generation());
            Claim existing = claimsByKey.get(key);
            if (existing != null && existing.getStatus() != ClaimStatus.INVALID) {
                log.debug("重复提交，返回已有声明: session={}, claim={}, status={}",
                        sessionId, existing.getClaimId(), existing.getStatus().wire());
                result.complete(existing.view());
                return;
            }
            Claim claim = new Claim(idGenerator.get(), sessionId, playerId, playerName, ticket,
                    ticket.toSnapshot(seen.calledNumbers(), seen.lastCalledNumber()), pattern, seen.generation(), loop.now());
            claim.transitionTo(ClaimStatus.PENDING);
            claims.put(claim.getClaimId(), claim);
            claimsByKey.put(key, claim);
            // 返回提交时刻的 pending 视图；广播完成前叫号方的回显可能已推进本地投影
            ClaimView pending = claim.view();
            ClaimSubmittedPayload payload = new ClaimSubmittedPayload(claim.getClaimId(), playerId, playerName, sessionId,
                    claim.getSnapshot(), pattern.id(), claim.getSubmittedAt(), claim.getGeneration());
            connection.publish(EventType.CLAIM_SUBMITTED, payload).whenComplete((v, ex) -> loop.execute(() -> {
                if (ex == null) {
                    log.info("声明已提交: session={}, claim={}, pattern={}", sessionId, claim.getClaimId(), pattern.id());
                    result.complete(pending);
                    return;
                }
                claims.remove(claim.getClaimId());
                claimsByKey.remove(key, claim);
                log.warn("声明提交失败: session={}, claim={}, cause={}", sessionId, claim.getClaimId(), ex.getMessage());
                result.completeExceptionally(ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex);
            }));
        });
        return result;
    }

    public Registration onClaimResolved(Consumer<ClaimView> handler) {
        resolvedHandlers.add(handler);
        return () -> resolvedHandlers.remove(handler);
    }

    /** 声明状态任意变化（含 validating / valid） */
    public Registration onClaimUpdated(Consumer<ClaimView> handler) {
        updatedHandlers.add(handler);
        return () -> updatedHandlers.remove(handler);
    }

    public CompletableFuture<Optional<ClaimView>> getClaim(String claimId) {
        CompletableFuture<Optional<ClaimView>> result = new CompletableFuture<>();
        loop.execute(() -> result.complete(Optional.ofNullable(claims.get(claimId)).map(Claim::view)));
        return result;
    }

    public CompletableFuture<List<ClaimView>> listClaims() {
        CompletableFuture<List<ClaimView>> result = new CompletableFuture<>();
        loop.execute(() -> result.complete(claims.values().stream().map(Claim::view).toList()));
        return result;
    }

    private void onClaimChecking(EventEnvelope env) {
        ClaimCheckingPayload p = env.payloadAs(ClaimCheckingPayload.class);
        if (p == null || p.getClaimIds() == null) {
            return;
        }
        ClaimStatus target = ClaimStatus.fromWire(p.getStatus()).orElse(null);
        if (target != ClaimStatus.VALIDATING && target != ClaimStatus.VALID) {
            log.debug("未知的 claim-checking 状态: {}", p.getStatus());
            return;
        }
        for (String id : p.getClaimIds()) {
            Claim claim = claims.get(id);
            if (claim != null && claim.advanceTo(target)) {
                fire(updatedHandlers, claim.view());
            }
        }
    }

    private void onClaimResolvedEvent(EventEnvelope env) {
        ClaimResolvedPayload p = env.payloadAs(ClaimResolvedPayload.class);
        if (p == null || p.getClaimIds() == null) {
            return;
        }
        ClaimStatus target = switch (String.valueOf(p.getResult())) {
            case "valid" -> ClaimStatus.VALIDATED;
            case "invalid" -> ClaimStatus.INVALID;
            case "rejected" -> ClaimStatus.REJECTED;
            default -> null;
        };
        if (target == null) {
            log.warn("未知的判定结果，已丢弃: session={}, result={}", sessionId, p.getResult());
            return;
        }
        for (String id : p.getClaimIds()) {
            Claim claim = claims.get(id);
            if (claim == null || !claim.advanceTo(target)) {
                continue;
            }
            InvalidReason code = reasonOf(p.getReasonCode());
            claim.explain(code, p.getReason(), p.getToGo(), p.getNotYetCalled());
            claim.assignGroup(p.getGroupId());
            if (p.getAllocation() != null) {
                claim.assignAllocation(PrizeAllocation.fromWire(p.getAllocation()));
            }
            log.info("声明已判定: session={}, claim={}, result={}", sessionId, id, target.wire());
            ClaimView view = claim.view();
            fire(updatedHandlers, view);
            fire(resolvedHandlers, view);
        }
    }

    private static InvalidReason reasonOf(String code) {
        if (code == null) {
            return null;
        }
        for (InvalidReason r : InvalidReason.values()) {
            if (r.code().equals(code)) {
                return r;
            }
        }
        return null;
    }

    private void fire(List<Consumer<ClaimView>> handlers, ClaimView view) {
        for (Consumer<ClaimView> h : handlers) {
            try {
                h.accept(view);
            } catch (RuntimeException e) {
                log.error("声明回调执行失败: session={}", sessionId, e);
            }
        }
    }
}
