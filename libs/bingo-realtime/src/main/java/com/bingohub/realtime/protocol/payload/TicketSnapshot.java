package com.bingohub.realtime.protocol.payload;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 声明时随附的票面快照。
 * - rows：票面网格（行 × 列，0 为空格）；
 * - calledNumbers / lastCalledNumber：玩家提交时看到的已叫号，仅作诊断，不参与判定。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TicketSnapshot {
    private String ticketId;
    private List<List<Integer>> rows;
    private List<Integer> calledNumbers;
    private Integer lastCalledNumber;
}
