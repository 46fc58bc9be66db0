package com.bingohub.bingoservice.caller.interfaces.http;

import com.bingohub.bingoservice.caller.domain.Session;
import com.bingohub.bingoservice.caller.interfaces.http.dto.CallNumberRequest;
import com.bingohub.bingoservice.caller.interfaces.http.dto.CallResponse;
import com.bingohub.bingoservice.caller.interfaces.http.dto.OpenSessionRequest;
import com.bingohub.bingoservice.caller.interfaces.http.dto.PatternRequest;
import com.bingohub.bingoservice.caller.service.CallerSessionService;
import com.bingohub.bingoservice.common.ApiResponse;
import com.bingohub.realtime.claim.WinPattern;
import com.bingohub.realtime.store.StoredCallState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 叫号方控制台 HTTP 接口：会话开启/结束、叫号、重置、切换图案。
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
@RequiredArgsConstructor
public class CallerRestController {

    private final CallerSessionService svc;

    /**
     * 开启会话（幂等）。
     */
    @PostMapping("/open")
    public ResponseEntity<ApiResponse<Session>> open(@PathVariable String sessionId,
                                                     @Valid @RequestBody OpenSessionRequest req) {
        WinPattern pattern = StringUtils.isBlank(req.getPattern()) ? null : WinPattern.fromId(req.getPattern());
        return ResponseEntity.ok(ApiResponse.success(svc.open(sessionId, req.getCallerId(), req.getGameType(), pattern)));
    }

    @PostMapping("/end")
    public ResponseEntity<ApiResponse<Session>> end(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.end(sessionId)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Session>> session(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.getSession(sessionId)));
    }

    /**
     * 叫号。重复号码不报错，响应里 duplicate=true。
     */
    @PostMapping("/calls")
    public ResponseEntity<ApiResponse<CallResponse>> call(@PathVariable String sessionId,
                                                          @Valid @RequestBody CallNumberRequest req) {
        int number = req.getNumber();
        return ResponseEntity.ok(ApiResponse.success(CallResponse.of(number, svc.callNumber(sessionId, number))));
    }

    @PostMapping("/reset")
    public ResponseEntity<ApiResponse<StoredCallState>> reset(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(StoredCallState.from(svc.resetGame(sessionId))));
    }

    @PutMapping("/pattern")
    public ResponseEntity<ApiResponse<StoredCallState>> pattern(@PathVariable String sessionId,
                                                                @Valid @RequestBody PatternRequest req) {
        WinPattern pattern = WinPattern.fromId(req.getPattern());
        return ResponseEntity.ok(ApiResponse.success(StoredCallState.from(svc.changePattern(sessionId, pattern))));
    }
}
