package com.bingohub.realtime.claim;

import com.bingohub.realtime.loop.EventLoop.ScheduledTask;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 并列组：同一代、同一图案在合并窗口内到达 valid 的声明。
 * OPEN（窗口中）→ AWAITING_DECISION（多人，等待叫号方选择分奖方式）→ RESOLVED。
 * 单人时窗口结束直接 RESOLVED。
 */
@Getter
public class ContentionGroup {

    public enum State {
        OPEN,
        AWAITING_DECISION,
        RESOLVED
    }

    private final String groupId;
    private final String sessionId;
    private final WinPattern pattern;
    private final long generation;
    private final long openedAt;
    private final List<Claim> claims = new ArrayList<>();
    private final CompletableFuture<ClaimResolution> outcome = new CompletableFuture<>();

    private State state = State.OPEN;
    private ClaimResolution resolution;
    private ScheduledTask windowTask;

    ContentionGroup(String groupId, String sessionId, WinPattern pattern, long generation, long openedAt) {
        this.groupId = groupId;
        this.sessionId = sessionId;
        this.pattern = pattern;
        this.generation = generation;
        this.openedAt = openedAt;
    }

    String prizeKey() {
        return prizeKey(generation, pattern);
    }

    static String prizeKey(long generation, WinPattern pattern) {
        return generation + ":" + pattern.id();
    }

    void add(Claim claim) {
        claims.add(claim);
        claim.assignGroup(groupId);
    }

    List<Claim> validClaims() {
        return claims.stream().filter(c -> c.getStatus() == ClaimStatus.VALID).toList();
    }

    void awaitDecision() {
        cancelWindow();
        state = State.AWAITING_DECISION;
    }

    void resolve(ClaimResolution resolution) {
        cancelWindow();
        this.state = State.RESOLVED;
        this.resolution = resolution;
        outcome.complete(resolution);
    }

    void abandon(RuntimeException cause) {
        cancelWindow();
        this.state = State.RESOLVED;
        outcome.completeExceptionally(cause);
    }

    void windowTask(ScheduledTask task) {
        this.windowTask = task;
    }

    void cancelWindow() {
        if (windowTask != null) {
            windowTask.cancel();
            windowTask = null;
        }
    }

    public boolean isResolved() {
        return state == State.RESOLVED;
    }

    public GroupView view() {
        return new GroupView(groupId, pattern.id(), generation, state.name().toLowerCase(), openedAt,
                Collections.unmodifiableList(claims.stream().map(Claim::getClaimId).toList()),
                validClaims().stream().map(Claim::getClaimId).toList(),
                resolution == null || resolution.allocation() == null ? null : resolution.allocation().wire());
    }
}
