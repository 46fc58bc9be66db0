package com.bingohub.realtime.claim;

import org.apache.commons.lang3.Validate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 玩家对票面的标记。
 * - 自动标记：标记集合 = 票面号码 ∩ 已叫号码；
 * - 手动标记：只认玩家显式标记的号码，标记票面上不存在的号码直接拒绝。
 */
public class TicketMarks {

    private final Ticket ticket;
    private final boolean autoMark;
    private final Set<Integer> explicit = new LinkedHashSet<>();

    private TicketMarks(Ticket ticket, boolean autoMark) {
        this.ticket = Validate.notNull(ticket, "ticket");
        this.autoMark = autoMark;
    }

    public static TicketMarks auto(Ticket ticket) {
        return new TicketMarks(ticket, true);
    }

    public static TicketMarks manual(Ticket ticket) {
        return new TicketMarks(ticket, false);
    }

    public Ticket ticket() {
        return ticket;
    }

    public boolean isAutoMark() {
        return autoMark;
    }

    public void mark(int number) {
        if (autoMark) {
            throw new IllegalStateException("自动标记模式下不能手动标记");
        }
        Validate.isTrue(ticket.contains(number), "号码 %s 不在票面上", number);
        explicit.add(number);
    }

    public void unmark(int number) {
        if (autoMark) {
            throw new IllegalStateException("自动标记模式下不能手动取消标记");
        }
        explicit.remove(number);
    }

    /**
     * 当前标记的号码。
     * @param calledNumbers 已叫号码（仅自动标记模式使用）
     */
    public Set<Integer> markedNumbers(Collection<Integer> calledNumbers) {
        if (!autoMark) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(explicit));
        }
        Set<Integer> out = new LinkedHashSet<>();
        for (Integer n : ticket.numbers()) {
            if (calledNumbers.contains(n)) {
                out.add(n);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    public Set<CellPosition> markedPositions(Collection<Integer> calledNumbers) {
        return ticket.markedPositions(markedNumbers(calledNumbers));
    }
}
