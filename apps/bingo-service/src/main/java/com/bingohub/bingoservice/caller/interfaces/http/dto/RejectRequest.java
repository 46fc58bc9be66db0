package com.bingohub.bingoservice.caller.interfaces.http.dto;

import lombok.Data;

@Data
public class RejectRequest {
    /** 驳回原因（可选，为空时使用默认文案） */
    private String reason;
}
