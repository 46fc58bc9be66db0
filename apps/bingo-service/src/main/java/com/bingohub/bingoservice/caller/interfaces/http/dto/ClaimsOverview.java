package com.bingohub.bingoservice.caller.interfaces.http.dto;

import com.bingohub.realtime.claim.ClaimView;
import com.bingohub.realtime.claim.GroupView;

import java.util.List;

/**
 * 会话内全部声明与并列组。
 */
public record ClaimsOverview(List<ClaimView> claims, List<GroupView> groups) {
}
