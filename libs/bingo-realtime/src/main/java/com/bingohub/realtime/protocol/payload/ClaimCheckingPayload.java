package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * claim-checking 载荷：status 为 validating 或 valid（valid 表示等待并列判定）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimCheckingPayload {
    private List<String> claimIds;
    private String status;
}
