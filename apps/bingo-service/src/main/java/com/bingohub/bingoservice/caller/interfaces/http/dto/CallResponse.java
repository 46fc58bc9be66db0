package com.bingohub.bingoservice.caller.interfaces.http.dto;

import com.bingohub.realtime.store.StoredCallState;
import com.bingohub.realtime.sync.CallResult;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 叫号结果。duplicate=true 表示该号码本局已叫过，状态未变化。
 * published=false 表示已持久化但广播失败，玩家会在重连后补齐。
 */
@Data
@AllArgsConstructor
public class CallResponse {
    private int number;
    private boolean duplicate;
    private boolean published;
    private StoredCallState state;

    public static CallResponse of(int number, CallResult result) {
        return new CallResponse(number, result.isDuplicate(), result.published(), StoredCallState.from(result.state()));
    }
}
