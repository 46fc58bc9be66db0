package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * claim-resolved 载荷。
 * - result：valid / invalid / rejected；
 * - allocation：多人并列时的分奖方式（shared / each-full），单人中奖时为空；
 * - reason / reasonCode / toGo / notYetCalled：invalid、rejected 时的说明与诊断。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimResolvedPayload {
    private List<String> claimIds;
    private String result;
    private String allocation;
    private String groupId;
    private String reasonCode;
    private String reason;
    private Integer toGo;
    private List<Integer> notYetCalled;
}
