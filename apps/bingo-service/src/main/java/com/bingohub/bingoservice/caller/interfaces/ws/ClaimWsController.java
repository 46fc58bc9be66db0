package com.bingohub.bingoservice.caller.interfaces.ws;

import com.bingohub.bingoservice.caller.interfaces.ws.dto.ClaimMessages.ClaimAck;
import com.bingohub.bingoservice.caller.interfaces.ws.dto.ClaimMessages.ErrorMsg;
import com.bingohub.bingoservice.caller.interfaces.ws.dto.ClaimMessages.SubmitClaimCmd;
import com.bingohub.bingoservice.caller.service.CallerSessionService;
import com.bingohub.realtime.claim.WinPattern;
import com.bingohub.realtime.error.BingoRealtimeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

/**
 * 声明 WebSocket 控制器
 * ----------------------------------------
 * 浏览器玩家发送 /app/bingo.claim，服务端校验票面结构后以 claim-submitted 广播到会话的 claims 频道，
 * 由叫号方的判定流程接手；受理回执点对点推送到 /user/queue/claims。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ClaimWsController {

    private final CallerSessionService svc;

    @MessageMapping("/bingo.claim")
    @SendToUser("/queue/claims")
    public ClaimAck submit(SubmitClaimCmd cmd) {
        if (cmd == null || StringUtils.isBlank(cmd.getSessionId())) {
            throw new IllegalArgumentException("sessionId 不能为空");
        }
        WinPattern pattern = WinPattern.fromId(cmd.getPattern());
        String claimId = svc.submitClaim(cmd.getSessionId(), cmd.getPlayerId(), cmd.getPlayerName(),
                cmd.getTicket(), pattern);
        return new ClaimAck(cmd.getSessionId(), claimId, pattern.id());
    }

    /**
     * 参数/状态错误：回给发送方，不影响其他玩家。
     */
    @MessageExceptionHandler({IllegalArgumentException.class, IllegalStateException.class, NullPointerException.class})
    @SendToUser("/queue/errors")
    public ErrorMsg onBadRequest(RuntimeException e) {
        log.debug("声明请求被拒绝: {}", e.getMessage());
        return new ErrorMsg("BAD_REQUEST", e.getMessage());
    }

    @MessageExceptionHandler(BingoRealtimeException.class)
    @SendToUser("/queue/errors")
    public ErrorMsg onUnavailable(BingoRealtimeException e) {
        log.warn("声明提交失败: {}", e.getMessage());
        return new ErrorMsg("UNAVAILABLE", e.getMessage());
    }
}
