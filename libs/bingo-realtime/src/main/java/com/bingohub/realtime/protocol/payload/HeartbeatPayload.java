package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatPayload {
    private String sessionId;
    private long timestamp;
}
