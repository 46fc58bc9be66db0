package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * number-called 载荷。
 * calledNumbers 可选：缺省表示“把 number 作为单个增量追加”，存在表示完整序列。
 * generation 可选：缺省时按当前代处理。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NumberCalledPayload {
    private Integer number;
    private List<Integer> calledNumbers;
    private String sessionId;
    private long timestamp;
    private Long generation;
}
