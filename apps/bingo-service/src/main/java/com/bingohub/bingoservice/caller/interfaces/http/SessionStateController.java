package com.bingohub.bingoservice.caller.interfaces.http;

import com.bingohub.bingoservice.caller.service.CallerSessionService;
import com.bingohub.bingoservice.common.ApiResponse;
import com.bingohub.realtime.connection.ConnectionStatus;
import com.bingohub.realtime.store.StoredCallState;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 只读接口：玩家重连后按此补齐已叫号码；叫号方查看连接状态。
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
@RequiredArgsConstructor
public class SessionStateController {

    private final CallerSessionService svc;

    /**
     * 存储中的权威叫号记录（已叫号码、最后一个号码、代数、当前图案）。
     */
    @GetMapping("/state")
    public ResponseEntity<ApiResponse<StoredCallState>> state(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(StoredCallState.from(svc.state(sessionId))));
    }

    @GetMapping("/connection")
    public ResponseEntity<ApiResponse<ConnectionStatus>> connection(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.connectionStatus(sessionId)));
    }
}
