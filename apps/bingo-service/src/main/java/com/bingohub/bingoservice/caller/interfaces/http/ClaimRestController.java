package com.bingohub.bingoservice.caller.interfaces.http;

import com.bingohub.bingoservice.caller.interfaces.http.dto.ClaimsOverview;
import com.bingohub.bingoservice.caller.interfaces.http.dto.DecisionRequest;
import com.bingohub.bingoservice.caller.interfaces.http.dto.RejectRequest;
import com.bingohub.bingoservice.caller.service.CallerSessionService;
import com.bingohub.bingoservice.common.ApiResponse;
import com.bingohub.realtime.claim.ClaimResolution;
import com.bingohub.realtime.claim.ClaimView;
import com.bingohub.realtime.claim.PrizeAllocation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 声明判定 HTTP 接口（叫号方）。
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions/{sessionId}/claims")
@RequiredArgsConstructor
public class ClaimRestController {

    private final CallerSessionService svc;

    @GetMapping
    public ResponseEntity<ApiResponse<ClaimsOverview>> list(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(new ClaimsOverview(svc.claims(sessionId), svc.groups(sessionId))));
    }

    /**
     * 分奖决定：同一并列组只记录第一次决定，之后的请求返回已记录的结果。
     */
    @PostMapping("/groups/{groupId}/decision")
    public ResponseEntity<ApiResponse<ClaimResolution>> decide(@PathVariable String sessionId,
                                                               @PathVariable String groupId,
                                                               @Valid @RequestBody DecisionRequest req) {
        PrizeAllocation allocation = PrizeAllocation.fromWire(req.getAllocation());
        log.info("收到分奖决定: session={}, group={}, allocation={}", sessionId, groupId, allocation.wire());
        return ResponseEntity.ok(ApiResponse.success(svc.decide(sessionId, groupId, allocation)));
    }

    @PostMapping("/{claimId}/reject")
    public ResponseEntity<ApiResponse<ClaimView>> reject(@PathVariable String sessionId,
                                                         @PathVariable String claimId,
                                                         @RequestBody(required = false) RejectRequest req) {
        String reason = req == null ? null : req.getReason();
        return ResponseEntity.ok(ApiResponse.success(svc.reject(sessionId, claimId, reason)));
    }
}
