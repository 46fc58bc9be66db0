package com.bingohub.bingoservice.caller.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话元信息（持久化到 Redis）。
 * 只包含可序列化字段；叫号序列单独由 CallStateStore 保存，运行态对象（连接、引擎）不落盘。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {
    /** 会话ID */
    private String sessionId;
    /** 玩法（展示用，如 75-ball / 90-ball） */
    private String gameType;
    /** 叫号方标识 */
    private String callerId;
    private SessionStatus status;
    /** 并列声明合并窗口（毫秒） */
    private long coalescingWindowMs;
    private long createdAt;
    private long endedAt;
}
