package com.bingohub.claimkafkanotifier.event;

import com.bingohub.realtime.claim.ClaimResolution;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 判定结果事件。
 *
 * 每产生一个 ClaimResolution 发布一条，供下游发奖 / 结算服务消费。
 * 消息 key 为 sessionId，保证同一会话的判定按顺序落在同一分区。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimResolvedEvent {

    private String resolutionId;

    private String sessionId;

    private String groupId;

    /** 图案 ID，如 oneLine */
    private String pattern;

    private long generation;

    /** SINGLE_WINNER / GROUP */
    private String kind;

    private List<String> winnerClaimIds;

    /**
     * 分奖方式（shared / each-full），单人中奖时为空
     */
    private String allocation;

    /**
     * 判定时间（时间戳）
     */
    private Long timestamp;

    public static ClaimResolvedEvent of(ClaimResolution resolution) {
        return new ClaimResolvedEvent(
                resolution.resolutionId(),
                resolution.sessionId(),
                resolution.groupId(),
                resolution.pattern().id(),
                resolution.generation(),
                resolution.kind().name(),
                resolution.winnerClaimIds(),
                resolution.allocation() == null ? null : resolution.allocation().wire(),
                resolution.resolvedAt());
    }
}
