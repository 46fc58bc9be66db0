package com.bingohub.realtime.claim;

import com.bingohub.realtime.connection.Registration;
import com.bingohub.realtime.connection.SessionConnection;
import com.bingohub.realtime.error.ClaimValidationException;
import com.bingohub.realtime.loop.EventLoop;
import com.bingohub.realtime.protocol.EventEnvelope;
import com.bingohub.realtime.protocol.EventType;
import com.bingohub.realtime.protocol.payload.ClaimCheckingPayload;
import com.bingohub.realtime.protocol.payload.ClaimResolvedPayload;
import com.bingohub.realtime.protocol.payload.ClaimSubmittedPayload;
import com.bingohub.realtime.sync.CallState;
import com.bingohub.realtime.sync.CallStateListener;
import com.bingohub.realtime.sync.CallSyncEngine;
import com.bingohub.realtime.sync.SyncRole;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * CallerClaimProtocol
 * -------------------------------------------------------
 * 叫号方的声明处理：接收 → 校验 → 合并窗口 → 判定。
 * -------------------------------------------------------
 * 流程：
 *  1) 收到 claim-submitted：登记为 pending，随即进入 validating 并广播 claim-checking；
 *  2) 以叫号方的权威 CallState 校验，未通过 → invalid（附原因与诊断）；
 *  3) 通过 → valid，按（代数, 图案）归入并列组；组首次出现时开启合并窗口；
 *  4) 窗口结束：只有一个有效声明 → validated，立即判定；
 *     多个 → 等待叫号方 decide(shared / each-full)，决定只记录一次并原子地作用于全组。
 * -------------------------------------------------------
 * 幂等：
 *  - 对已终结的声明重复提交，不新建声明，只重发已有结果；
 *  - 对已判定的组重复 decide，返回已记录的结果，不再广播。
 * 奖项判定后，同一（代数, 图案）迟到的有效声明一律 rejected（奖项已判定）。
 */
public class CallerClaimProtocol {

    private static final Logger log = LoggerFactory.getLogger(CallerClaimProtocol.class);

    private final String sessionId;
    private final SessionConnection connection;
    private final CallSyncEngine callSync;
    private final EventLoop loop;
    private final long coalescingWindowMs;
    private final ClaimValidator validator = new ClaimValidator();
    private final Supplier<String> idGenerator;

    // 以下集合只在事件循环上访问
    private final Map<String, Claim> claims = new LinkedHashMap<>();
    private final Map<ClaimKey, Claim> claimsByKey = new HashMap<>();
    // claimId -> 登记时叫号方的代数
    private final Map<String, Long> registeredGeneration = new HashMap<>();
    private final Map<String, ContentionGroup> groups = new LinkedHashMap<>();
    // prizeKey -> 尚未判定的组
    private final Map<String, ContentionGroup> pendingGroups = new HashMap<>();
    // prizeKey -> 已判定结果
    private final Map<String, ClaimResolution> awarded = new HashMap<>();
    private final List<Registration> registrations = new ArrayList<>();

    private final List<Consumer<ClaimView>> submittedHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<GroupView>> decisionHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<ClaimResolution>> resolvedHandlers = new CopyOnWriteArrayList<>();
    private final List<Consumer<ClaimView>> updatedHandlers = new CopyOnWriteArrayList<>();

    public CallerClaimProtocol(SessionConnection connection, CallSyncEngine callSync, EventLoop loop, long coalescingWindowMs) {
        this(connection, callSync, loop, coalescingWindowMs, () -> UUID.randomUUID().toString());
    }

    public CallerClaimProtocol(SessionConnection connection,
                               CallSyncEngine callSync,
                               EventLoop loop,
                               long coalescingWindowMs,
                               Supplier<String> idGenerator) {
        Validate.isTrue(callSync.role() == SyncRole.CALLER, "CallerClaimProtocol 需要叫号方的 CallSyncEngine");
        Validate.isTrue(coalescingWindowMs > 0, "合并窗口必须大于 0");
        this.sessionId = connection.sessionId();
        this.connection = connection;
        this.callSync = callSync;
        this.loop = loop;
        this.coalescingWindowMs = coalescingWindowMs;
        this.idGenerator = idGenerator;
    }

    public void start() {
        loop.execute(() -> {
            if (!registrations.isEmpty()) {
                return;
            }
            registrations.add(connection.subscribe(EventType.CLAIM_SUBMITTED, this::onClaimSubmittedEvent));
            registrations.add(callSync.addListener(new CallStateListener() {
                @Override
                public void onGameReset(CallState state) {
                    expireGroupsBefore(state.generation());
                }
            }));
        });
    }

    public void stop() {
        loop.execute(() -> {
            registrations.forEach(Registration::unsubscribe);
            registrations.clear();
            groups.values().forEach(ContentionGroup::cancelWindow);
        });
    }

    // ------------------------------------------------------------------
    // 订阅
    // ------------------------------------------------------------------

    /** 新声明登记（pending）时回调 */
    public Registration onClaimSubmitted(Consumer<ClaimView> handler) {
        return register(submittedHandlers, handler);
    }

    /** 多人并列、需要叫号方选择分奖方式时回调 */
    public Registration onDecisionRequired(Consumer<GroupView> handler) {
        return register(decisionHandlers, handler);
    }

    /** 每产生一个 ClaimResolution 回调一次 */
    public Registration onClaimResolved(Consumer<ClaimResolution> handler) {
        return register(resolvedHandlers, handler);
    }

    /** 任意声明状态变化 */
    public Registration onClaimUpdated(Consumer<ClaimView> handler) {
        return register(updatedHandlers, handler);
    }

    // ------------------------------------------------------------------
    // 叫号方操作
    // ------------------------------------------------------------------

    /**
     * 对一组有效声明立即判定（不再等待窗口结束）。
     * 单个声明立即 validated；多个声明返回的 future 在叫号方 decide 之后才完成。
     *
     * @throws IllegalArgumentException 声明不存在、不属于同一并列组
     * @throws IllegalStateException    声明不处于 valid
     */
    public CompletableFuture<ClaimResolution> resolveClaims(Collection<String> claimIds) {
        return onLoop(() -> {
            Validate.notEmpty(claimIds, "claimIds 不能为空");
            ContentionGroup group = null;
            for (String id : claimIds) {
                Claim claim = requireClaim(id);
                if (claim.getStatus() != ClaimStatus.VALID) {
                    throw new IllegalStateException("声明不处于待判定状态: " + id + " (" + claim.getStatus().wire() + ")");
                }
                ContentionGroup g = groups.get(claim.getGroupId());
                if (group != null && group != g) {
                    throw new IllegalArgumentException("声明不属于同一并列组");
                }
                group = g;
            }
            return closeWindow(group);
        }).thenCompose(f -> f);
    }

    /**
     * 叫号方的分奖决定。只记录一次：组已判定时返回已有结果。
     */
    public CompletableFuture<ClaimResolution> decide(String groupId, PrizeAllocation allocation) {
        return onLoop(() -> {
            Validate.notNull(allocation, "allocation 不能为空");
            ContentionGroup group = groups.get(groupId);
            if (group == null) {
                throw new IllegalArgumentException("并列组不存在: " + groupId);
            }
            if (group.isResolved()) {
                if (group.getResolution() == null) {
                    throw new IllegalStateException("并列组已作废: " + groupId);
                }
                log.info("重复的分奖决定已忽略: session={}, group={}, recorded={}, requested={}", sessionId, groupId,
                        group.getResolution().allocation() == null ? "-" : group.getResolution().allocation().wire(),
                        allocation.wire());
                return group.getResolution();
            }
            List<Claim> valid = group.validClaims();
            if (valid.isEmpty()) {
                throw new IllegalStateException("并列组内没有待判定的声明: " + groupId);
            }
            if (valid.size() == 1) {
                return resolveSingle(group, valid.get(0));
            }
            return resolveGroup(group, valid, allocation);
        });
    }

    /**
     * 叫号方驳回一个仍在等待判定的有效声明。
     */
    public CompletableFuture<ClaimView> rejectClaim(String claimId, String reason) {
        return onLoop(() -> {
            Claim claim = requireClaim(claimId);
            if (claim.getStatus() != ClaimStatus.VALID) {
                throw new IllegalStateException("只能驳回待判定的有效声明: " + claimId + " (" + claim.getStatus().wire() + ")");
            }
            String message = StringUtils.defaultIfBlank(reason, ClaimMessages.CALLER_REJECTED);
            reject(claim, InvalidReason.CALLER_REJECTED, message);
            log.info("叫号方驳回声明: session={}, claim={}, reason={}", sessionId, claimId, message);
            ContentionGroup group = groups.get(claim.getGroupId());
            if (group != null && group.getState() == ContentionGroup.State.AWAITING_DECISION) {
                List<Claim> remaining = group.validClaims();
                if (remaining.size() == 1) {
                    resolveSingle(group, remaining.get(0));
                } else if (remaining.isEmpty()) {
                    abandon(group, "并列组内声明均已驳回");
                } else {
                    fire(decisionHandlers, group.view());
                }
            }
            return claim.view();
        });
    }

    public CompletableFuture<List<ClaimView>> listClaims() {
        return onLoop(() -> claims.values().stream().map(Claim::view).toList());
    }

    public CompletableFuture<List<GroupView>> listGroups() {
        return onLoop(() -> groups.values().stream().map(ContentionGroup::view).toList());
    }

    // ------------------------------------------------------------------
    // 接收与校验
    // ------------------------------------------------------------------

    private void onClaimSubmittedEvent(EventEnvelope env) {
        ClaimSubmittedPayload p = env.payloadAs(ClaimSubmittedPayload.class);
        if (p == null || StringUtils.isBlank(p.getClaimId())) {
            log.warn("claim-submitted 缺少 claimId，已丢弃: session={}", sessionId);
            return;
        }
        Claim existing = claims.get(p.getClaimId());
        if (existing != null) {
            replayIfTerminal(existing);
            return;
        }
        Ticket ticket;
        WinPattern pattern;
        try {
            ticket = Ticket.fromSnapshot(p.getTicketSnapshot());
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("票面数据无效: session={}, claim={}, cause={}", sessionId, p.getClaimId(), e.getMessage());
            publishResolved(ClaimResolvedPayload.builder()
                    .claimIds(List.of(p.getClaimId()))
                    .result(ClaimStatus.INVALID.wire())
                    .reasonCode(InvalidReason.MALFORMED_TICKET.code())
                    .reason(ClaimMessages.MALFORMED_TICKET)
                    .build());
            return;
        }
        try {
            pattern = WinPattern.fromId(p.getPattern());
        } catch (IllegalArgumentException e) {
            publishResolved(ClaimResolvedPayload.builder()
                    .claimIds(List.of(p.getClaimId()))
                    .result(ClaimStatus.INVALID.wire())
                    .reasonCode(InvalidReason.PATTERN_NOT_ACTIVE.code())
                    .reason(e.getMessage())
                    .build());
            return;
        }
        Claim claim = new Claim(p.getClaimId(), sessionId, p.getPlayerId(), p.getPlayerName(), ticket,
                p.getTicketSnapshot(), pattern, p.getGeneration(), p.getTimestamp() > 0 ? p.getTimestamp() : loop.now());
        ClaimKey key = ClaimKey.of(claim, callSync.currentState().generation());
        Claim sameKey = claimsByKey.get(key);
        if (sameKey != null && sameKey.getStatus() != ClaimStatus.INVALID) {
            log.info("重复声明: session={}, claim={}, existing={}", sessionId, claim.getClaimId(), sameKey.getClaimId());
            replayIfTerminal(sameKey);
            return;
        }
        claim.transitionTo(ClaimStatus.PENDING);
        claims.put(claim.getClaimId(), claim);
        claimsByKey.put(key, claim);
        registeredGeneration.put(claim.getClaimId(), key.generation());
        log.info("收到声明: session={}, claim={}, player={}, pattern={}, gen={}",
                sessionId, claim.getClaimId(), claim.getPlayerName(), pattern.id(), claim.getGeneration());
        fire(submittedHandlers, claim.view());
        beginValidation(claim);
    }

    private void beginValidation(Claim claim) {
        claim.transitionTo(ClaimStatus.VALIDATING);
        fire(updatedHandlers, claim.view());
        publish(EventType.CLAIM_CHECKING,
                new ClaimCheckingPayload(List.of(claim.getClaimId()), ClaimStatus.VALIDATING.wire()));
        callSync.ensureLoaded().whenComplete((state, ex) -> loop.execute(() -> {
            if (ex != null) {
                log.warn("读取叫号状态失败，按内存状态校验: session={}, claim={}, cause={}",
                        sessionId, claim.getClaimId(), ex.getMessage());
            }
            check(claim, callSync.currentState());
        }));
    }

    private void check(Claim claim, CallState state) {
        if (claim.getStatus() != ClaimStatus.VALIDATING) {
            return;
        }
        try {
            validator.validate(claim, state);
        } catch (ClaimValidationException e) {
            invalidate(claim, e);
            return;
        }
        // 代数以叫号方为准，校验已保证两者一致
        long generation = state.generation();
        String prizeKey = ContentionGroup.prizeKey(generation, claim.getPattern());
        if (awarded.containsKey(prizeKey)) {
            reject(claim, InvalidReason.PRIZE_ALREADY_AWARDED, ClaimMessages.PRIZE_ALREADY_AWARDED);
            log.info("奖项已判定，迟到的声明被驳回: session={}, claim={}", sessionId, claim.getClaimId());
            return;
        }
        claim.transitionTo(ClaimStatus.VALID);
        ContentionGroup group = pendingGroups.get(prizeKey);
        if (group == null) {
            group = new ContentionGroup(idGenerator.get(), sessionId, claim.getPattern(), generation, loop.now());
            groups.put(group.getGroupId(), group);
            pendingGroups.put(prizeKey, group);
            ContentionGroup opened = group;
            group.windowTask(loop.schedule(() -> onWindowClosed(opened), coalescingWindowMs));
            log.info("开启合并窗口: session={}, group={}, pattern={}, windowMs={}",
                    sessionId, group.getGroupId(), claim.getPattern().id(), coalescingWindowMs);
        }
        group.add(claim);
        log.info("声明有效: session={}, claim={}, group={}", sessionId, claim.getClaimId(), group.getGroupId());
        fire(updatedHandlers, claim.view());
        publish(EventType.CLAIM_CHECKING, new ClaimCheckingPayload(List.of(claim.getClaimId()), ClaimStatus.VALID.wire()));
        if (group.getState() == ContentionGroup.State.AWAITING_DECISION) {
            fire(decisionHandlers, group.view());
        }
    }

    // ------------------------------------------------------------------
    // 判定
    // ------------------------------------------------------------------

    private void onWindowClosed(ContentionGroup group) {
        if (group.getState() != ContentionGroup.State.OPEN) {
            return;
        }
        closeWindow(group);
    }

    private CompletableFuture<ClaimResolution> closeWindow(ContentionGroup group) {
        if (group.getState() != ContentionGroup.State.OPEN) {
            return group.getOutcome();
        }
        List<Claim> valid = group.validClaims();
        if (valid.isEmpty()) {
            abandon(group, "并列组内没有有效声明");
        } else if (valid.size() == 1) {
            resolveSingle(group, valid.get(0));
        } else {
            group.awaitDecision();
            log.info("多个有效声明，等待叫号方决定分奖方式: session={}, group={}, claims={}",
                    sessionId, group.getGroupId(), valid.stream().map(Claim::getClaimId).toList());
            fire(decisionHandlers, group.view());
        }
        return group.getOutcome();
    }

    private ClaimResolution resolveSingle(ContentionGroup group, Claim winner) {
        winner.transitionTo(ClaimStatus.VALIDATED);
        ClaimResolution resolution = new ClaimResolution(idGenerator.get(), sessionId, group.getGroupId(),
                group.getPattern(), group.getGeneration(), ClaimResolution.Kind.SINGLE_WINNER,
                List.of(winner.getClaimId()), null, loop.now());
        finish(group, resolution, List.of(winner));
        return resolution;
    }

    private ClaimResolution resolveGroup(ContentionGroup group, List<Claim> winners, PrizeAllocation allocation) {
        winners.forEach(c -> {
            c.transitionTo(ClaimStatus.VALIDATED);
            c.assignAllocation(allocation);
        });
        ClaimResolution resolution = new ClaimResolution(idGenerator.get(), sessionId, group.getGroupId(),
                group.getPattern(), group.getGeneration(), ClaimResolution.Kind.GROUP,
                winners.stream().map(Claim::getClaimId).toList(), allocation, loop.now());
        finish(group, resolution, winners);
        return resolution;
    }

    private void finish(ContentionGroup group, ClaimResolution resolution, List<Claim> winners) {
        group.resolve(resolution);
        pendingGroups.remove(group.prizeKey(), group);
        awarded.put(group.prizeKey(), resolution);
        log.info("判定完成: session={}, group={}, kind={}, winners={}, allocation={}",
                sessionId, group.getGroupId(), resolution.kind(), resolution.winnerClaimIds(),
                resolution.allocation() == null ? "-" : resolution.allocation().wire());
        winners.forEach(c -> fire(updatedHandlers, c.view()));
        publishResolved(ClaimResolvedPayload.builder()
                .claimIds(resolution.winnerClaimIds())
                .result(ClaimStatus.VALID.wire())
                .allocation(resolution.allocation() == null ? null : resolution.allocation().wire())
                .groupId(group.getGroupId())
                .build());
        fire(resolvedHandlers, resolution);
    }

    private void abandon(ContentionGroup group, String why) {
        group.abandon(new IllegalStateException(why));
        pendingGroups.remove(group.prizeKey(), group);
        log.info("并列组作废: session={}, group={}, reason={}", sessionId, group.getGroupId(), why);
    }

    /**
     * 重置后，旧代尚未判定的组全部作废，组内有效声明驳回。
     * 只保留上一局的记录供叫号方查看，更早的已终结声明、组与判定结果一并清理。
     */
    private void expireGroupsBefore(long generation) {
        for (ContentionGroup group : new ArrayList<>(pendingGroups.values())) {
            if (group.getGeneration() >= generation) {
                continue;
            }
            group.validClaims().forEach(c -> reject(c, InvalidReason.GAME_RESET, ClaimMessages.GAME_RESET));
            abandon(group, ClaimMessages.GAME_RESET);
        }
        pruneBefore(generation - 1);
    }

    private void pruneBefore(long cutoff) {
        int before = claims.size();
        claims.values().removeIf(claim -> {
            Long gen = registeredGeneration.get(claim.getClaimId());
            if (gen == null || gen >= cutoff || !claim.isTerminal()) {
                return false;
            }
            registeredGeneration.remove(claim.getClaimId());
            claimsByKey.remove(ClaimKey.of(claim, gen), claim);
            return true;
        });
        groups.values().removeIf(g -> g.isResolved() && g.getGeneration() < cutoff);
        awarded.values().removeIf(r -> r.generation() < cutoff);
        if (claims.size() < before) {
            log.info("清理旧局声明记录: session={}, removed={}, before gen={}", sessionId, before - claims.size(), cutoff);
        }
    }

    private void invalidate(Claim claim, ClaimValidationException e) {
        claim.transitionTo(ClaimStatus.INVALID);
        claim.explain(e.getReason(), e.getMessage(), e.getToGo(), e.getNotYetCalled());
        log.info("声明无效: session={}, claim={}, reason={}", sessionId, claim.getClaimId(), e.getMessage());
        fire(updatedHandlers, claim.view());
        publishResolved(resolvedPayloadOf(claim));
    }

    private void reject(Claim claim, InvalidReason code, String message) {
        claim.transitionTo(ClaimStatus.REJECTED);
        claim.explain(code, message, null, List.of());
        fire(updatedHandlers, claim.view());
        publishResolved(resolvedPayloadOf(claim));
    }

    /**
     * 已终结的声明被重复提交时重发结果，未终结的忽略。
     */
    private void replayIfTerminal(Claim claim) {
        if (claim.isTerminal()) {
            publishResolved(resolvedPayloadOf(claim));
        }
    }

    private ClaimResolvedPayload resolvedPayloadOf(Claim claim) {
        String result = claim.getStatus() == ClaimStatus.VALIDATED ? ClaimStatus.VALID.wire() : claim.getStatus().wire();
        return ClaimResolvedPayload.builder()
                .claimIds(List.of(claim.getClaimId()))
                .result(result)
                .allocation(claim.getAllocation() == null ? null : claim.getAllocation().wire())
                .groupId(claim.getGroupId())
                .reasonCode(claim.getReasonCode() == null ? null : claim.getReasonCode().code())
                .reason(claim.getReason())
                .toGo(claim.getToGo())
                .notYetCalled(claim.getNotYetCalled())
                .build();
    }

    // ------------------------------------------------------------------
    // 工具
    // ------------------------------------------------------------------

    private void publishResolved(ClaimResolvedPayload payload) {
        publish(EventType.CLAIM_RESOLVED, payload);
    }

    private void publish(EventType type, Object payload) {
        connection.publish(type, payload).whenComplete((v, ex) -> {
            if (ex != null) {
                log.warn("声明事件广播失败: session={}, type={}, cause={}", sessionId, type.wire(), ex.getMessage());
            }
        });
    }

    private Claim requireClaim(String claimId) {
        Claim claim = claims.get(claimId);
        if (claim == null) {
            throw new IllegalArgumentException("声明不存在: " + claimId);
        }
        return claim;
    }

    private <T> CompletableFuture<T> onLoop(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        loop.execute(() -> {
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private <T> void fire(List<Consumer<T>> handlers, T value) {
        for (Consumer<T> h : handlers) {
            try {
                h.accept(value);
            } catch (RuntimeException e) {
                log.error("声明回调执行失败: session={}", sessionId, e);
            }
        }
    }

    private static <T> Registration register(List<Consumer<T>> handlers, Consumer<T> handler) {
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }
}
