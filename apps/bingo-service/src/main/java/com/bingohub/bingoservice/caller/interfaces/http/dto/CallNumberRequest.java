package com.bingohub.bingoservice.caller.interfaces.http.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class CallNumberRequest {
    @NotNull(message = "number 不能为空")
    @Positive(message = "number 必须为正整数")
    private Integer number;
}
