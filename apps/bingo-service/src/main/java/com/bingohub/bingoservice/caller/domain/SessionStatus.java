package com.bingohub.bingoservice.caller.domain;

/**
 * 会话状态：
 * PENDING 由外部大厅创建、尚未开启；ACTIVE 可叫号、接收声明；ENDED 已结束，只读。
 */
public enum SessionStatus {
    PENDING,
    ACTIVE,
    ENDED
}
