package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * generation 可选：缺省时按当前代处理。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PatternChangedPayload {
    private String sessionId;
    /** 图案 ID，如 oneLine / fullHouse */
    private String pattern;
    private Long generation;
}
