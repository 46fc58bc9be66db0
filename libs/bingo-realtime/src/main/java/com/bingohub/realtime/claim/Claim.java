package com.bingohub.realtime.claim;

import com.bingohub.realtime.protocol.payload.TicketSnapshot;
import lombok.Getter;

import java.util.List;

/**
 * 中奖声明。
 * 只由声明协议的判定步骤修改（状态相关方法均为包内可见）。
 */
@Getter
public class Claim {

    private final String claimId;
    private final String sessionId;
    private final String playerId;
    private final String playerName;
    private final Ticket ticket;
    /** 提交时的票面快照，calledNumbers 仅作诊断 */
    private final TicketSnapshot snapshot;
    private final WinPattern pattern;
    /** 提交方看到的代数，叫号方只用来比对 */
    private final long generation;
    private final long submittedAt;

    private ClaimStatus status = ClaimStatus.NONE;
    private String groupId;
    private PrizeAllocation allocation;
    private InvalidReason reasonCode;
    private String reason;
    private Integer toGo;
    private List<Integer> notYetCalled = List.of();

    Claim(String claimId,
          String sessionId,
          String playerId,
          String playerName,
          Ticket ticket,
          TicketSnapshot snapshot,
          WinPattern pattern,
          long generation,
          long submittedAt) {
        this.claimId = claimId;
        this.sessionId = sessionId;
        this.playerId = playerId;
        this.playerName = playerName;
        this.ticket = ticket;
        this.snapshot = snapshot;
        this.pattern = pattern;
        this.generation = generation;
        this.submittedAt = submittedAt;
    }

    /**
     * 按直接边迁移。
     * @throws IllegalStateException 非法迁移
     */
    void transitionTo(ClaimStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("声明状态不允许从 " + status.wire() + " 变为 " + next.wire() + ": " + claimId);
        }
        status = next;
    }

    /**
     * 玩家投影：只向前推进，重复或倒退的事件直接忽略。
     * @return 是否发生了变化
     */
    boolean advanceTo(ClaimStatus target) {
        if (!status.canAdvanceTo(target)) {
            return false;
        }
        status = target;
        return true;
    }

    void explain(InvalidReason code, String message, Integer toGo, List<Integer> notYetCalled) {
        this.reasonCode = code;
        this.reason = message;
        this.toGo = toGo;
        this.notYetCalled = notYetCalled == null ? List.of() : List.copyOf(notYetCalled);
    }

    void assignGroup(String groupId) {
        this.groupId = groupId;
    }

    void assignAllocation(PrizeAllocation allocation) {
        this.allocation = allocation;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public ClaimView view() {
        return new ClaimView(claimId, sessionId, playerId, playerName, ticket.ticketId(), pattern.id(), generation,
                status.wire(), submittedAt, groupId, allocation == null ? null : allocation.wire(),
                reasonCode == null ? null : reasonCode.code(), reason, toGo, notYetCalled);
    }
}
