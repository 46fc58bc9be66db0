package com.bingohub.bingoservice.caller.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 分奖决定请求体。
 */
@Data
public class DecisionRequest {
    /** shared：平分奖金；each-full：每人全额 */
    @NotBlank(message = "allocation 不能为空")
    private String allocation;
}
