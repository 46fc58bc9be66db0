package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimSubmittedPayload {
    private String claimId;
    private String playerId;
    private String playerName;
    private String sessionId;
    private TicketSnapshot ticketSnapshot;
    private String pattern;
    private long timestamp;
    /** 玩家提交时所在代数 */
    private long generation;
}
