package com.bingohub.realtime.claim;

/**
 * 声明幂等键：同一玩家、同一票面、同一图案、同一代只对应一个声明。
 * 叫号方一侧的代数取自己的权威状态，玩家上报的代数不参与。
 */
public record ClaimKey(String playerId, String ticketId, WinPattern pattern, long generation) {

    static ClaimKey of(Claim claim, long generation) {
        return new ClaimKey(claim.getPlayerId(), claim.getTicket().ticketId(), claim.getPattern(), generation);
    }
}
