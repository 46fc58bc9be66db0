package com.bingohub.realtime.store;

import com.bingohub.realtime.sync.CallState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 持久化的叫号记录。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredCallState {

    private String sessionId;
    @Builder.Default
    private List<Integer> calledNumbers = new ArrayList<>();
    private Integer lastCalledNumber;
    private long generation;
    private String currentWinPattern;
    private long updatedAt;

    public static StoredCallState from(CallState state) {
        return StoredCallState.builder()
                .sessionId(state.sessionId())
                .calledNumbers(new ArrayList<>(state.calledNumbers()))
                .lastCalledNumber(state.lastCalledNumber())
                .generation(state.generation())
                .currentWinPattern(state.activePattern())
                .updatedAt(state.updatedAt())
                .build();
    }

    public CallState toCallState(String fallbackSessionId) {
        String id = sessionId != null ? sessionId : fallbackSessionId;
        return new CallState(id, calledNumbers, lastCalledNumber, updatedAt, generation, currentWinPattern);
    }
}
