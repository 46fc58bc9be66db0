package com.bingohub.bingoservice.caller.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class PatternRequest {
    /** 图案 ID：oneLine / twoLines / threeLines / fullHouse / coverAll / corners */
    @NotBlank(message = "pattern 不能为空")
    private String pattern;
}
