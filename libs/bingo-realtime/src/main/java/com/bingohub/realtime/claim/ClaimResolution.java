package com.bingohub.realtime.claim;

import java.util.List;

/**
 * 一次判定的结果（创建后不可变）。
 *
 * @param resolutionId   判定 ID
 * @param sessionId      会话
 * @param groupId        对应的并列组
 * @param pattern        图案
 * @param generation     所在代
 * @param kind           单人中奖 / 多人并列
 * @param winnerClaimIds 中奖声明
 * @param allocation     多人并列时的分奖方式；单人中奖为 null
 * @param resolvedAt     判定时间（毫秒）
 */
public record ClaimResolution(String resolutionId,
                              String sessionId,
                              String groupId,
                              WinPattern pattern,
                              long generation,
                              Kind kind,
                              List<String> winnerClaimIds,
                              PrizeAllocation allocation,
                              long resolvedAt) {

    public ClaimResolution {
        winnerClaimIds = List.copyOf(winnerClaimIds);
    }

    public enum Kind {
        SINGLE_WINNER,
        GROUP
    }
}
