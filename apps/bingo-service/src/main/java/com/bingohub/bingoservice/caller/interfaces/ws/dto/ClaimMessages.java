package com.bingohub.bingoservice.caller.interfaces.ws.dto;

import com.bingohub.realtime.protocol.payload.TicketSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 声明相关的 STOMP 消息（DTO）
 * ----------------------------------------
 *   1. 前端 -> 后端：SubmitClaimCmd（/app/bingo.claim）
 *   2. 后端 -> 前端：ClaimAck（/user/queue/claims）、ErrorMsg（/user/queue/errors）
 * 判定进度与结果不在这里回执，统一走 /topic/session.{sessionId}。
 */
public class ClaimMessages {

    /**
     * 提交声明命令（客户端 → 服务端）
     * 字段：
     *   - sessionId ：会话编号；
     *   - playerId / playerName ：玩家标识与昵称；
     *   - ticket ：票面快照（rows 为判定依据，calledNumbers 仅作诊断）；
     *   - pattern ：声明的图案 ID。
     */
    @Data
    public static class SubmitClaimCmd {
        private String sessionId;
        private String playerId;
        private String playerName;
        private TicketSnapshot ticket;
        private String pattern;
    }

    /** 已受理回执：声明已广播，等待叫号方判定 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClaimAck {
        private String sessionId;
        private String claimId;
        private String pattern;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorMsg {
        private String code;
        private String message;
    }
}
