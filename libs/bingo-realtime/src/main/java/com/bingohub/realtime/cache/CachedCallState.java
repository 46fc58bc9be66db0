package com.bingohub.realtime.cache;

import com.bingohub.realtime.sync.CallState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 本地缓存布局：按 sessionId 存 {calledNumbers, lastCalledNumber, timestamp}。
 * generation / activePattern 为扩展字段，旧缓存缺省时按 0 / null 处理。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CachedCallState {

    private String sessionId;
    private List<Integer> calledNumbers = new ArrayList<>();
    private Integer lastCalledNumber;
    private long timestamp;
    private Long generation;
    private String activePattern;

    public static CachedCallState from(CallState state) {
        return new CachedCallState(state.sessionId(), new ArrayList<>(state.calledNumbers()),
                state.lastCalledNumber(), state.updatedAt(), state.generation(), state.activePattern());
    }

    public CallState toCallState(String sessionId) {
        return new CallState(sessionId, calledNumbers, lastCalledNumber, timestamp,
                generation == null ? 0L : generation, activePattern);
    }
}
