package com.bingohub.realtime.claim;

import java.util.List;

/**
 * 并列组只读快照。state：open / awaiting_decision / resolved。
 */
public record GroupView(String groupId,
                        String pattern,
                        long generation,
                        String state,
                        long openedAt,
                        List<String> claimIds,
                        List<String> validClaimIds,
                        String allocation) {
}
