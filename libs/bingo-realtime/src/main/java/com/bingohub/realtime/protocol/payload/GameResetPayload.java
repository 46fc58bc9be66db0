package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * game-reset 载荷；generation 为重置后的新代数（可选）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameResetPayload {
    private String sessionId;
    private Long generation;
}
