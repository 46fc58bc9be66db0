package com.bingohub.realtime.claim;

import com.bingohub.realtime.protocol.payload.TicketSnapshot;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 玩家票面（号码不可变）。
 * - rows：行 × 列网格，0 表示空格；
 * - 非空格号码在整张票内唯一。
 */
public final class Ticket {

    private final String ticketId;
    private final List<List<Integer>> rows;
    private final List<Integer> numbers;
    private final Set<Integer> numberSet;

    public Ticket(String ticketId, List<List<Integer>> rows) {
        Validate.notBlank(ticketId, "ticketId 不能为空");
        Validate.notEmpty(rows, "票面不能为空");
        int cols = rows.get(0) == null ? 0 : rows.get(0).size();
        Validate.isTrue(cols > 0, "票面列数必须大于 0");
        List<List<Integer>> copy = new ArrayList<>(rows.size());
        List<Integer> all = new ArrayList<>();
        for (List<Integer> row : rows) {
            Validate.isTrue(row != null && row.size() == cols, "票面必须为规则网格");
            for (Integer n : row) {
                Validate.isTrue(n != null && n >= 0, "票面号码非法: %s", String.valueOf(n));
                if (n > 0) {
                    all.add(n);
                }
            }
            copy.add(List.copyOf(row));
        }
        Validate.isTrue(!all.isEmpty(), "票面没有任何号码");
        Validate.isTrue(new HashSet<>(all).size() == all.size(), "票面号码重复");
        this.ticketId = ticketId;
        this.rows = List.copyOf(copy);
        this.numbers = List.copyOf(all);
        this.numberSet = Collections.unmodifiableSet(new LinkedHashSet<>(all));
    }

    public static Ticket fromSnapshot(TicketSnapshot snapshot) {
        Validate.notNull(snapshot, "ticketSnapshot 不能为空");
        return new Ticket(snapshot.getTicketId(), snapshot.getRows());
    }

    public TicketSnapshot toSnapshot(List<Integer> calledNumbers, Integer lastCalledNumber) {
        List<List<Integer>> grid = new ArrayList<>(rows.size());
        rows.forEach(r -> grid.add(new ArrayList<>(r)));
        return new TicketSnapshot(ticketId, grid,
                calledNumbers == null ? new ArrayList<>() : new ArrayList<>(calledNumbers), lastCalledNumber);
    }

    public String ticketId() {
        return ticketId;
    }

    public List<List<Integer>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return rows.get(0).size();
    }

    /** 全部号码（行优先，不含空格） */
    public List<Integer> numbers() {
        return numbers;
    }

    /** 某一行的号码（不含空格） */
    public List<Integer> rowNumbers(int row) {
        return rows.get(row).stream().filter(n -> n > 0).toList();
    }

    public boolean contains(int number) {
        return numberSet.contains(number);
    }

    /**
     * 根据已标记号码计算标记格子集合。
     */
    public Set<CellPosition> markedPositions(Collection<Integer> marked) {
        Set<Integer> m = marked instanceof Set<Integer> s ? s : new HashSet<>(marked);
        Set<CellPosition> out = new LinkedHashSet<>();
        for (int r = 0; r < rows.size(); r++) {
            List<Integer> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                int n = row.get(c);
                if (n > 0 && m.contains(n)) {
                    out.add(new CellPosition(r, c));
                }
            }
        }
        return out;
    }
}
