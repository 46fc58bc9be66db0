package com.bingohub.bingoservice.caller.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 开启会话请求体。
 */
@Data
public class OpenSessionRequest {
    /**
     * 叫号方标识（由外部身份系统给出，这里只当普通字符串）。
     */
    @NotBlank(message = "callerId 不能为空")
    private String callerId;

    /**
     * 玩法（可选，如 75-ball / 90-ball）。
     */
    private String gameType;

    /**
     * 初始中奖图案（可选，如 oneLine）。
     */
    private String pattern;
}
