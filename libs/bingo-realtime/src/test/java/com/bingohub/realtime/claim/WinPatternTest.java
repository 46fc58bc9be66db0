package com.bingohub.realtime.claim;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WinPatternTest {

    // 90 球票面：3 行 × 9 列，每行 5 个号码
    private static final Ticket TICKET = new Ticket("t-1", List.of(
            List.of(7, 0, 23, 0, 41, 0, 56, 0, 72),
            List.of(0, 12, 0, 34, 0, 45, 0, 67, 88),
            List.of(3, 0, 19, 0, 38, 50, 0, 61, 0)));

    @Test
    void oneLineCompletesWithAnyFullRow() {
        PatternProgress p = WinPattern.ONE_LINE.evaluate(TICKET, Set.of(7, 23, 41, 56, 72));
        assertTrue(p.complete());
        assertEquals(0, p.toGo());
    }

    @Test
    void toGoCountsTheCheapestRows() {
        // 第一行差 1 个，第三行差 2 个
        Set<Integer> called = Set.of(7, 23, 41, 56, 3, 19, 38);
        assertEquals(1, WinPattern.ONE_LINE.evaluate(TICKET, called).toGo());
        assertEquals(3, WinPattern.TWO_LINES.evaluate(TICKET, called).toGo());
        assertEquals(8, WinPattern.THREE_LINES.evaluate(TICKET, called).toGo());
    }

    @Test
    void fullHouseNeedsEveryNumber() {
        Set<Integer> all = Set.copyOf(TICKET.numbers());
        assertTrue(WinPattern.FULL_HOUSE.evaluate(TICKET, all).complete());
        assertTrue(WinPattern.COVER_ALL.evaluate(TICKET, all).complete());
        assertEquals(15, WinPattern.FULL_HOUSE.evaluate(TICKET, Set.of()).toGo());
    }

    @Test
    void cornersUseFirstAndLastNumberOfOuterRows() {
        assertTrue(WinPattern.CORNERS.evaluate(TICKET, Set.of(7, 72, 3, 61)).complete());
        assertEquals(1, WinPattern.CORNERS.evaluate(TICKET, Set.of(7, 72, 3)).toGo());
    }

    @Test
    void moreLinesThanRowsIsUnattainable() {
        Ticket twoRows = new Ticket("t-2", List.of(List.of(1, 2, 3), List.of(4, 5, 6)));
        PatternProgress p = WinPattern.THREE_LINES.evaluate(twoRows, Set.of(1, 2, 3, 4, 5, 6));
        assertFalse(p.attainable());
        assertFalse(p.complete());
    }

    @Test
    void parsesIdsWithGamePrefix() {
        assertSame(WinPattern.ONE_LINE, WinPattern.fromId("oneLine"));
        assertSame(WinPattern.FULL_HOUSE, WinPattern.fromId("MAINSTAGE_fullHouse"));
        assertSame(WinPattern.CORNERS, WinPattern.fromId("Corners"));
        assertThrows(IllegalArgumentException.class, () -> WinPattern.fromId("diagonal"));
        assertThrows(IllegalArgumentException.class, () -> WinPattern.fromId(" "));
    }
}
