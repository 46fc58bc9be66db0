package com.bingohub.realtime.claim;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 中奖图案规则。id 为线上/存储中使用的标识（oneLine、fullHouse 等）。
 */
public enum WinPattern {

    ONE_LINE("oneLine", "一条线") {
        @Override
        public PatternProgress evaluate(Ticket ticket, Set<Integer> called) {
            return lines(ticket, called, 1);
        }
    },
    TWO_LINES("twoLines", "两条线") {
        @Override
        public PatternProgress evaluate(Ticket ticket, Set<Integer> called) {
            return lines(ticket, called, 2);
        }
    },
    THREE_LINES("threeLines", "三条线") {
        @Override
        public PatternProgress evaluate(Ticket ticket, Set<Integer> called) {
            return lines(ticket, called, 3);
        }
    },
    FULL_HOUSE("fullHouse", "全满") {
        @Override
        public PatternProgress evaluate(Ticket ticket, Set<Integer> called) {
            return PatternProgress.of(missing(ticket.numbers(), called));
        }
    },
    /** 75 球玩法的全满 */
    COVER_ALL("coverAll", "全覆盖") {
        @Override
        public PatternProgress evaluate(Ticket ticket, Set<Integer> called) {
            return PatternProgress.of(missing(ticket.numbers(), called));
        }
    },
    /** 首行与末行的首尾号码 */
    CORNERS("corners", "四角") {
        @Override
        public PatternProgress evaluate(Ticket ticket, Set<Integer> called) {
            List<Integer> top = ticket.rowNumbers(0);
            List<Integer> bottom = ticket.rowNumbers(ticket.rowCount() - 1);
            if (top.isEmpty() || bottom.isEmpty()) {
                return PatternProgress.unattainable();
            }
            Set<Integer> corners = new LinkedHashSet<>();
            corners.add(top.get(0));
            corners.add(top.get(top.size() - 1));
            corners.add(bottom.get(0));
            corners.add(bottom.get(bottom.size() - 1));
            return PatternProgress.of(missing(corners, called));
        }
    };

    private final String id;
    private final String displayName;

    WinPattern(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * 按已叫号码评估票面。
     */
    public abstract PatternProgress evaluate(Ticket ticket, Set<Integer> called);

    /**
     * 解析图案 ID，兼容带玩法前缀的写法（如 MAINSTAGE_oneLine）。
     *
     * @throws IllegalArgumentException 未知图案
     */
    public static WinPattern fromId(String raw) {
        if (StringUtils.isBlank(raw)) {
            throw new IllegalArgumentException("图案不能为空");
        }
        String id = raw.contains("_") ? StringUtils.substringAfterLast(raw, "_") : raw;
        for (WinPattern p : values()) {
            if (p.id.equalsIgnoreCase(id.trim())) {
                return p;
            }
        }
        throw new IllegalArgumentException("未知的中奖图案: " + raw);
    }

    private static PatternProgress lines(Ticket ticket, Set<Integer> called, int required) {
        List<Integer> missingPerRow = new ArrayList<>();
        for (int r = 0; r < ticket.rowCount(); r++) {
            List<Integer> row = ticket.rowNumbers(r);
            if (!row.isEmpty()) {
                missingPerRow.add(missing(row, called));
            }
        }
        if (missingPerRow.size() < required) {
            return PatternProgress.unattainable();
        }
        missingPerRow.sort(Integer::compareTo);
        int toGo = 0;
        for (int i = 0; i < required; i++) {
            toGo += missingPerRow.get(i);
        }
        return PatternProgress.of(toGo);
    }

    private static int missing(Iterable<Integer> numbers, Set<Integer> called) {
        int count = 0;
        for (Integer n : numbers) {
            if (!called.contains(n)) {
                count++;
            }
        }
        return count;
    }
}
