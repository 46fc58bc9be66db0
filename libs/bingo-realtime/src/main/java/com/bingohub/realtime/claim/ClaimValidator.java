package com.bingohub.realtime.claim;

import com.bingohub.realtime.error.ClaimValidationException;
import com.bingohub.realtime.sync.CallState;

import java.util.List;
import java.util.Set;

/**
 * 声明校验（叫号方）。
 * 只以叫号方自己的权威 CallState 为准；玩家快照里的 calledNumbers 仅用于生成诊断信息，不影响结论。
 */
public class ClaimValidator {

    /**
     * @return 完成度（complete 必为 true）
     * @throws ClaimValidationException 未通过
     */
    public PatternProgress validate(Claim claim, CallState authoritative) {
        if (claim.getGeneration() < authoritative.generation()) {
            throw new ClaimValidationException(InvalidReason.GAME_RESET, ClaimMessages.GAME_RESET);
        }
        if (claim.getGeneration() != authoritative.generation()) {
            throw new ClaimValidationException(InvalidReason.GENERATION_MISMATCH,
                    ClaimMessages.formatGenerationMismatch(claim.getGeneration(), authoritative.generation()));
        }
        String active = authoritative.activePattern();
        if (active == null) {
            throw new ClaimValidationException(InvalidReason.PATTERN_NOT_ACTIVE, ClaimMessages.NO_ACTIVE_PATTERN);
        }
        if (!claim.getPattern().id().equals(active)) {
            throw new ClaimValidationException(InvalidReason.PATTERN_NOT_ACTIVE,
                    ClaimMessages.formatPatternNotActive(claim.getPattern().displayName()));
        }
        Set<Integer> called = authoritative.calledSet();
        PatternProgress progress = claim.getPattern().evaluate(claim.getTicket(), called);
        if (!progress.attainable()) {
            throw new ClaimValidationException(InvalidReason.UNREACHABLE,
                    ClaimMessages.formatUnreachable(claim.getPattern().displayName()));
        }
        if (!progress.complete()) {
            throw new ClaimValidationException(InvalidReason.PATTERN_INCOMPLETE,
                    ClaimMessages.formatToGo(progress.toGo()), progress.toGo(), notYetCalled(claim, called));
        }
        return progress;
    }

    /**
     * 玩家认为已叫、但叫号方尚未叫出的号码。
     */
    static List<Integer> notYetCalled(Claim claim, Set<Integer> called) {
        if (claim.getSnapshot() == null || claim.getSnapshot().getCalledNumbers() == null) {
            return List.of();
        }
        return claim.getSnapshot().getCalledNumbers().stream()
                .filter(n -> n != null && !called.contains(n))
                .distinct()
                .toList();
    }
}
