package com.bingohub.realtime.claim;

import java.util.List;

/**
 * 声明的只读快照（对外暴露，避免跨线程读可变对象）。
 */
public record ClaimView(String claimId,
                        String sessionId,
                        String playerId,
                        String playerName,
                        String ticketId,
                        String pattern,
                        long generation,
                        String status,
                        long submittedAt,
                        String groupId,
                        String allocation,
                        String reasonCode,
                        String reason,
                        Integer toGo,
                        List<Integer> notYetCalled) {
}
